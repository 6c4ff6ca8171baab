package de.mirkosertic.contentindexer.indexer;

import de.mirkosertic.contentindexer.scan.ScanDispatcher;
import de.mirkosertic.contentindexer.store.FingerprintStore;
import de.mirkosertic.contentindexer.store.Fingerprints;
import de.mirkosertic.contentindexer.store.RecordKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Finds files whose content differs from the stored fingerprint and queues them for indexing.
 * <p>
 * The walk itself only lists files. Each directory becomes one task on the indexing worker that
 * fingerprints its files and enqueues the changed ones. Deleted files produce no change
 * notification, so a prune task per record kind follows the directory tasks.
 */
public class TreeScanner {

    private static final Logger logger = LoggerFactory.getLogger(TreeScanner.class);

    private final IndexExecutorService executor;
    private final IndexScheduler scheduler;
    private final ScanDispatcher dispatcher;
    private final FingerprintStore fingerprintStore;
    private final IndexStatisticsTracker statisticsTracker;

    public TreeScanner(final IndexExecutorService executor,
                       final IndexScheduler scheduler,
                       final ScanDispatcher dispatcher,
                       final FingerprintStore fingerprintStore,
                       final IndexStatisticsTracker statisticsTracker) {
        this.executor = executor;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.fingerprintStore = fingerprintStore;
        this.statisticsTracker = statisticsTracker;
    }

    public TreeScanResult scanIndex(final Path contentDir) throws IOException {
        final long startTime = System.currentTimeMillis();
        final Deque<List<Path>> openDirectories = new ArrayDeque<>();
        final int[] counts = new int[2];

        logger.info("Scanning content directory: {}", contentDir);

        Files.walkFileTree(contentDir, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                        openDirectories.push(new ArrayList<>());
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && dispatcher.isIndexable(file)) {
                            openDirectories.peek().add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(final Path file, final IOException e) {
                        if (e instanceof FileSystemLoopException) {
                            logger.warn("Skipping symbolic link loop at {}", file);
                        } else if (e instanceof NoSuchFileException) {
                            logger.debug("{} vanished during the scan", file);
                        } else {
                            logger.warn("Cannot read {}: {}", file, e.getMessage());
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(final Path dir, final IOException e) {
                        if (e != null) {
                            logger.warn("Error listing directory {}: {}", dir, e.getMessage());
                        }
                        final List<Path> files = openDirectories.pop();
                        counts[0]++;
                        counts[1] += files.size();
                        executor.execute(() -> compareDirectory(contentDir, dir, files));
                        return FileVisitResult.CONTINUE;
                    }
                });

        schedulePrune();

        final TreeScanResult result = new TreeScanResult(counts[0], counts[1], System.currentTimeMillis() - startTime);
        logger.info("Scan of {} submitted: {} directories, {} files in {}ms",
                contentDir, result.directories(), result.files(), result.walkTimeMs());
        return result;
    }

    /**
     * Queue one prune task per record kind, followed by a commit.
     */
    public void schedulePrune() {
        for (final RecordKind kind : RecordKind.values()) {
            executor.execute(() -> {
                final int pruned = fingerprintStore.pruneMissing(kind);
                statisticsTracker.recordPruned(pruned);
                if (pruned > 0) {
                    logger.info("Pruned {} missing {} files", pruned, kind.fieldValue());
                }
            });
        }
        executor.execute(() -> {
            try {
                fingerprintStore.commit();
            } catch (final IOException e) {
                logger.error("Error committing metadata index after pruning", e);
            }
        });
    }

    void compareDirectory(final Path contentDir, final Path directory, final List<Path> files) {
        int changed = 0;
        for (final Path file : files) {
            try {
                if (hasChanged(file)) {
                    scheduler.enqueue(file, contentDir.relativize(file).toString(), false);
                    changed++;
                }
            } catch (final NoSuchFileException e) {
                logger.debug("{} vanished before it could be compared", file);
            } catch (final IOException | RuntimeException e) {
                logger.warn("Error comparing {} with its fingerprint", file, e);
            }
        }
        if (changed > 0) {
            logger.debug("{}: {} of {} files changed", directory, changed, files.size());
        }
    }

    private boolean hasChanged(final Path file) throws IOException {
        final String current = Fingerprints.of(file);
        final Optional<String> stored = fingerprintStore.get(file);
        return stored.isEmpty() || !stored.get().equals(current);
    }
}
