package de.mirkosertic.contentindexer.indexer;

import java.nio.file.Path;

public interface FileChangeListener {

    void onFileCreated(Path file);

    void onFileModified(Path file);

    void onFileDeleted(Path file);
}
