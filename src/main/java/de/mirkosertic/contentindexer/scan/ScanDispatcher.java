package de.mirkosertic.contentindexer.scan;

import de.mirkosertic.contentindexer.config.ApplicationConfig;
import de.mirkosertic.contentindexer.store.MetadataIndexService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a file to the scanner registered for its extension and maps the scanner's result to
 * a {@link ScanOutcome}. Extensions match case-sensitively against the end of the file name.
 */
public class ScanDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ScanDispatcher.class);

    private final Map<String, ContentScanner> scannersByExtension = new LinkedHashMap<>();

    public ScanDispatcher() {
    }

    public static ScanDispatcher create(final ApplicationConfig config, final MetadataIndexService index) {
        final ScanDispatcher dispatcher = new ScanDispatcher();
        dispatcher.register(config.getEntryExtensions(), new EntryScanner(index, config.getTimezone()));
        dispatcher.register(config.getCategoryExtensions(), new CategoryScanner(index));
        return dispatcher;
    }

    public void register(final List<String> extensions, final ContentScanner scanner) {
        for (final String extension : extensions) {
            scannersByExtension.put(extension, scanner);
        }
    }

    public boolean isIndexable(final Path file) {
        return scannerFor(file).isPresent();
    }

    public ScanOutcome scanFile(final Path fullPath, @Nullable final String relativePath, final boolean fixup) {
        final Optional<ContentScanner> scanner = scannerFor(fullPath);
        if (scanner.isEmpty()) {
            logger.debug("Skipping {}: not an indexable file", fullPath);
            return ScanOutcome.SKIPPED;
        }

        final ScanResult result;
        try {
            result = scanner.get().scan(fullPath, relativePath, fixup);
        } catch (final NoSuchFileException | FileNotFoundException e) {
            logger.debug("{} vanished while scanning", fullPath);
            return ScanOutcome.MISSING;
        } catch (final Exception e) {
            logger.warn("Error scanning {} (fixup={}): {}", fullPath, fixup, e.getMessage(), e);
            return ScanOutcome.TRANSIENT_FAILURE;
        }

        if (result == null) {
            return ScanOutcome.NOT_APPLICABLE;
        }
        return switch (result.status()) {
            case INDEXED -> {
                logger.debug("Indexed {} as {}", fullPath, result.recordId());
                yield ScanOutcome.SUCCESS;
            }
            case FAILED -> ScanOutcome.TRANSIENT_FAILURE;
            case NOT_APPLICABLE -> ScanOutcome.NOT_APPLICABLE;
        };
    }

    private Optional<ContentScanner> scannerFor(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        final String name = fileName.toString();
        for (final Map.Entry<String, ContentScanner> entry : scannersByExtension.entrySet()) {
            if (name.endsWith(entry.getKey()) && name.length() > entry.getKey().length()) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
