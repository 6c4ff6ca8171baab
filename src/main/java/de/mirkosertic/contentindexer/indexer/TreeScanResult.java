package de.mirkosertic.contentindexer.indexer;

/**
 * Summary of a tree walk. The comparisons themselves run later on the indexing worker.
 */
public record TreeScanResult(
        /** Directories handed to the worker. */
        int directories,
        /** Indexable files found in them. */
        int files,
        long walkTimeMs
) {
}
