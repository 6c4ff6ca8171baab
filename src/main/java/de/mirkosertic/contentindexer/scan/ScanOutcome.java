package de.mirkosertic.contentindexer.scan;

/**
 * What happened to a single file handed to the {@link ScanDispatcher}.
 */
public enum ScanOutcome {
    /** Scanned and indexed. */
    SUCCESS,
    /** Scanning failed; a fixup pass may repair the file. */
    TRANSIENT_FAILURE,
    /** Indexable file that the scanner declined. Not retried. */
    NOT_APPLICABLE,
    /** Not an indexable file type. */
    SKIPPED,
    /** The file vanished before it could be read. */
    MISSING
}
