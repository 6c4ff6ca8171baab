package de.mirkosertic.contentindexer.indexer;

import de.mirkosertic.contentindexer.scan.ScanDispatcher;
import de.mirkosertic.contentindexer.scan.ScanOutcome;
import de.mirkosertic.contentindexer.store.FingerprintStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Coalesces change notifications into batches and processes them on the single indexing worker.
 * <p>
 * Producers add {@link WorkItem}s to a pending set and, if no pass is scheduled or running,
 * schedule one after the configured wait time. A pass swaps the pending set for an empty one
 * and processes the snapshot outside the lock. Items added while a pass runs are picked up by
 * a continuation that the pass schedules before it gives up the worker handle, so at most one
 * pass is active and no item is left behind.
 * <p>
 * A scan that fails is retried once in fixup mode, which allows the scanner to repair the file.
 * A failing fixup is terminal: it is logged and the file stays unindexed until it changes.
 */
public class IndexScheduler {

    private static final Logger logger = LoggerFactory.getLogger(IndexScheduler.class);

    private final IndexExecutorService executor;
    private final ScanDispatcher dispatcher;
    private final FingerprintStore fingerprintStore;
    private final IndexStatisticsTracker statisticsTracker;
    private final Duration waitTime;

    private final Object lock = new Object();
    // guarded by lock
    private Set<WorkItem> pending = new HashSet<>();
    private @Nullable Future<?> workerHandle;
    private boolean shutdown;

    public IndexScheduler(final IndexExecutorService executor,
                          final ScanDispatcher dispatcher,
                          final FingerprintStore fingerprintStore,
                          final IndexStatisticsTracker statisticsTracker,
                          final Duration waitTime) {
        if (waitTime.isNegative()) {
            throw new IllegalArgumentException("waitTime must not be negative: " + waitTime);
        }
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.fingerprintStore = fingerprintStore;
        this.statisticsTracker = statisticsTracker;
        this.waitTime = waitTime;
    }

    /**
     * Queue a file for indexing. Identical requests made before the next pass collapse into one.
     */
    public void enqueue(final Path fullPath, @Nullable final String relativePath, final boolean fixup) {
        final WorkItem item = new WorkItem(fullPath, relativePath, fixup);
        synchronized (lock) {
            if (shutdown) {
                logger.debug("Ignoring {} after shutdown", item);
                return;
            }
            pending.add(item);
            scheduleLocked(waitTime);
        }
    }

    private void scheduleLocked(final Duration delay) {
        if (workerHandle != null && !workerHandle.isDone()) {
            return;
        }
        try {
            workerHandle = executor.schedule(this::drainAndProcess, delay);
        } catch (final RejectedExecutionException e) {
            logger.warn("Indexing worker rejected a pass, {} items stay pending", pending.size());
            workerHandle = null;
        }
    }

    /**
     * One pass of the worker. Runs only on the indexing worker, except in tests.
     */
    void drainAndProcess() {
        final Set<WorkItem> batch;
        synchronized (lock) {
            batch = pending;
            pending = new HashSet<>();
        }

        final boolean hadItems = !batch.isEmpty();
        try {
            if (hadItems && !isShutdown()) {
                logger.debug("Processing {} pending items", batch.size());
                for (final WorkItem item : batch) {
                    processOne(item);
                }
                commitStore();
                statisticsTracker.passCompleted();
            }
        } finally {
            synchronized (lock) {
                workerHandle = null;
                // Items added during this pass saw a running handle and did not schedule
                if (!shutdown && (hadItems || !pending.isEmpty())) {
                    scheduleLocked(Duration.ZERO);
                }
            }
        }
    }

    ScanOutcome processOne(final WorkItem item) {
        final Path path = item.fullPath();
        ScanOutcome outcome;
        try {
            if (!Files.isRegularFile(path)) {
                outcome = ScanOutcome.MISSING;
            } else {
                outcome = dispatcher.scanFile(path, item.relativePath(), item.fixup());
            }
            switch (outcome) {
                case SUCCESS -> fingerprintStore.set(path);
                case MISSING -> {
                    logger.debug("{} no longer exists, removing its records", path);
                    fingerprintStore.forget(path);
                }
                default -> {
                    // NOT_APPLICABLE and SKIPPED leave the fingerprint untouched
                }
            }
        } catch (final IOException | RuntimeException e) {
            logger.warn("Error processing {} (fixup={})", path, item.fixup(), e);
            outcome = ScanOutcome.TRANSIENT_FAILURE;
        }

        statisticsTracker.recordOutcome(outcome);
        if (outcome == ScanOutcome.TRANSIENT_FAILURE) {
            handleTransientFailure(item);
        }
        return outcome;
    }

    private void handleTransientFailure(final WorkItem item) {
        if (!item.fixup()) {
            logger.debug("Scheduling fixup for {}", item.fullPath());
            statisticsTracker.fixupScheduled();
            enqueue(item.fullPath(), item.relativePath(), true);
            return;
        }

        logger.warn("Giving up on {}: fixup did not help, file stays unindexed until it changes", item.fullPath());
        statisticsTracker.terminalFailure();
        try {
            fingerprintStore.set(item.fullPath());
        } catch (final IOException | RuntimeException e) {
            logger.warn("Could not record fingerprint of failed file {}", item.fullPath(), e);
        }
    }

    private void commitStore() {
        try {
            fingerprintStore.commit();
        } catch (final IOException e) {
            logger.error("Error committing metadata index", e);
        }
    }

    /**
     * Pending items plus tasks waiting for the worker. Empty once the worker has been shut down.
     */
    public OptionalInt queueDepth() {
        if (executor.isShutdown()) {
            return OptionalInt.empty();
        }
        synchronized (lock) {
            return OptionalInt.of(pending.size() + executor.queueSize());
        }
    }

    /**
     * Wait until nothing is pending, no pass is scheduled and the worker queue is empty.
     *
     * @return true if the scheduler became idle within the timeout
     */
    public boolean awaitIdle(final Duration timeout) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (isIdle()) {
                return true;
            }
            Thread.sleep(10);
        }
        return isIdle();
    }

    private boolean isIdle() {
        synchronized (lock) {
            return pending.isEmpty() && workerHandle == null && executor.isIdle();
        }
    }

    private boolean isShutdown() {
        synchronized (lock) {
            return shutdown;
        }
    }

    /**
     * Stop accepting work and stop the worker once the current pass is finished. Items still
     * pending are dropped; the next tree scan finds them again.
     */
    public void shutdown() {
        final int dropped;
        synchronized (lock) {
            shutdown = true;
            dropped = pending.size();
            pending.clear();
        }
        if (dropped > 0) {
            logger.info("Dropping {} pending items on shutdown", dropped);
        }
        executor.shutdown();
    }
}
