package de.mirkosertic.contentindexer.indexer;

import de.mirkosertic.contentindexer.scan.ScanOutcome;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters fed by the scheduler and the tree scanner.
 */
public class IndexStatisticsTracker {

    private final AtomicLong passes = new AtomicLong(0);
    private final AtomicLong processed = new AtomicLong(0);
    private final AtomicLong succeeded = new AtomicLong(0);
    private final AtomicLong fixups = new AtomicLong(0);
    private final AtomicLong terminalFailures = new AtomicLong(0);
    private final AtomicLong skipped = new AtomicLong(0);
    private final AtomicLong missing = new AtomicLong(0);
    private final AtomicLong pruned = new AtomicLong(0);

    private final long startTime = System.currentTimeMillis();
    private volatile long lastPassTime = 0;

    public void passCompleted() {
        passes.incrementAndGet();
        lastPassTime = System.currentTimeMillis();
    }

    public void recordOutcome(final ScanOutcome outcome) {
        processed.incrementAndGet();
        switch (outcome) {
            case SUCCESS -> succeeded.incrementAndGet();
            case NOT_APPLICABLE, SKIPPED -> skipped.incrementAndGet();
            case MISSING -> missing.incrementAndGet();
            case TRANSIENT_FAILURE -> {
                // counted as fixup or terminal failure by the caller
            }
        }
    }

    public void fixupScheduled() {
        fixups.incrementAndGet();
    }

    public void terminalFailure() {
        terminalFailures.incrementAndGet();
    }

    public void recordPruned(final long count) {
        pruned.addAndGet(count);
    }

    public IndexStatistics getStatistics() {
        return new IndexStatistics(
                passes.get(),
                processed.get(),
                succeeded.get(),
                fixups.get(),
                terminalFailures.get(),
                skipped.get(),
                missing.get(),
                pruned.get(),
                startTime,
                lastPassTime
        );
    }
}
