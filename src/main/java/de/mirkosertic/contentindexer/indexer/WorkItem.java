package de.mirkosertic.contentindexer.indexer;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file waiting to be indexed. Identity covers all three components, so a normal attempt and
 * its fixup retry are distinct items.
 */
public record WorkItem(Path fullPath, @Nullable String relativePath, boolean fixup) {

    public WorkItem {
        Objects.requireNonNull(fullPath, "fullPath");
    }

    public WorkItem asFixup() {
        return new WorkItem(fullPath, relativePath, true);
    }
}
