package de.mirkosertic.contentindexer.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single indexing worker. Drain passes, per-directory tree scan tasks and prune tasks all
 * run here, one at a time and in submission order.
 */
public class IndexExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(IndexExecutorService.class);

    private final ScheduledThreadPoolExecutor executor;
    // submitted and not yet finished
    private final AtomicInteger outstanding = new AtomicInteger(0);

    public IndexExecutorService() {
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "indexer");
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ScheduledThreadPoolExecutor(1, threadFactory);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        logger.info("IndexExecutorService initialized");
    }

    public ScheduledFuture<?> schedule(final Runnable task, final Duration delay) {
        outstanding.incrementAndGet();
        try {
            return executor.schedule(tracked(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
            outstanding.decrementAndGet();
            throw e;
        }
    }

    public void execute(final Runnable task) {
        schedule(task, Duration.ZERO);
    }

    private Runnable tracked(final Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (final RuntimeException e) {
                logger.error("Indexing task failed", e);
            } finally {
                outstanding.decrementAndGet();
            }
        };
    }

    /**
     * Number of tasks waiting for the worker, delayed ones included.
     */
    public int queueSize() {
        return executor.getQueue().size();
    }

    /**
     * No task running and none waiting.
     */
    public boolean isIdle() {
        return outstanding.get() == 0;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Let the running task finish, drop delayed ones and stop the worker.
     */
    public void shutdown() {
        logger.info("Shutting down IndexExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("IndexExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for IndexExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
