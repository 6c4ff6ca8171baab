package de.mirkosertic.contentindexer.indexer;

/**
 * Counters of the indexing worker since startup.
 */
public record IndexStatistics(
        /** Drain passes that found work. */
        long passes,
        /** Work items taken from the pending set. */
        long processed,
        long succeeded,
        /** Items re-enqueued in fixup mode after a transient failure. */
        long fixups,
        /** Fixup attempts that failed again. */
        long terminalFailures,
        /** Items that were not indexable or that the scanner declined. */
        long skipped,
        /** Items whose file had vanished. */
        long missing,
        /** Paths removed by prune passes. */
        long pruned,
        long startTimeMs,
        /** Epoch millis of the last finished pass, 0 before the first one. */
        long lastPassTimeMs
) {
}
