package de.mirkosertic.contentindexer.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Turns file change notifications below the content directory into work items. A move
 * arrives as a delete of the old path and a create of the new one.
 */
public class ContentWatchListener implements FileChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(ContentWatchListener.class);

    private final Path contentDir;
    private final IndexScheduler scheduler;

    public ContentWatchListener(final Path contentDir, final IndexScheduler scheduler) {
        this.contentDir = contentDir;
        this.scheduler = scheduler;
    }

    @Override
    public void onFileCreated(final Path file) {
        logger.debug("File created: {}", file);
        enqueue(file);
    }

    @Override
    public void onFileModified(final Path file) {
        logger.debug("File modified: {}", file);
        enqueue(file);
    }

    @Override
    public void onFileDeleted(final Path file) {
        logger.debug("File deleted: {}", file);
        enqueue(file);
    }

    private void enqueue(final Path file) {
        final String relativePath = file.startsWith(contentDir) ? contentDir.relativize(file).toString() : null;
        scheduler.enqueue(file, relativePath, false);
    }
}
