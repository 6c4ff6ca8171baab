package de.mirkosertic.contentindexer.indexer;

/**
 * Persisted state of the last completed tree scan.
 * <p>
 * Saved to {@code ~/.contentindexer/index-state.yaml} after every tree scan so that the
 * {@code status} command can report it without a running indexer.
 */
public record IndexState(
        /** Epoch-millis timestamp when the worker finished comparing the last tree scan. */
        long lastScanTimeMs,
        /** Number of fingerprint records at that time. */
        long lastFingerprintCount,
        /** Schema version of the index that was scanned. */
        int schemaVersion,
        /** Content directory that was scanned. */
        String contentDirectory
) {
}
