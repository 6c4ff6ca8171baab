package de.mirkosertic.contentindexer.scan;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns one content file into index records.
 * <p>
 * Implementations must not block indefinitely: they run on the single indexing worker.
 */
@FunctionalInterface
public interface ContentScanner {

    /**
     * @param fullPath     the file to scan
     * @param relativePath path below the content directory, {@code null} if unknown
     * @param fixup        whether the scanner may rewrite the file to add missing required headers
     */
    ScanResult scan(Path fullPath, @Nullable String relativePath, boolean fixup) throws IOException;
}
