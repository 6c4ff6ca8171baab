package de.mirkosertic.contentindexer.scan;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Value returned by a {@link ContentScanner}.
 */
public record ScanResult(Status status, @Nullable String recordId) {

    public enum Status {
        INDEXED,
        FAILED,
        NOT_APPLICABLE
    }

    private static final ScanResult FAILED = new ScanResult(Status.FAILED, null);
    private static final ScanResult NOT_APPLICABLE = new ScanResult(Status.NOT_APPLICABLE, null);

    public static ScanResult indexed(final String recordId) {
        return new ScanResult(Status.INDEXED, Objects.requireNonNull(recordId, "recordId"));
    }

    public static ScanResult failed() {
        return FAILED;
    }

    public static ScanResult notApplicable() {
        return NOT_APPLICABLE;
    }
}
