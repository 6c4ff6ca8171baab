package de.mirkosertic.contentindexer.store;

/**
 * Last known state of a content file.
 */
public record FingerprintRecord(
        /** Path of the file, unique key. */
        String filePath,
        /** Content digest, see {@link Fingerprints}. */
        String fingerprint,
        /** Modification time in epoch millis when the fingerprint was taken. */
        long fileMtime
) {
}
