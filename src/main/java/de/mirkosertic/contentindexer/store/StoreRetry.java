package de.mirkosertic.contentindexer.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.NoSuchFileException;

/**
 * Bounded retry around a store write. Only I/O failures are retried; a vanished source file
 * ({@link NoSuchFileException}, {@link FileNotFoundException}) is a result, not a conflict,
 * and is rethrown immediately.
 */
public class StoreRetry {

    private static final Logger logger = LoggerFactory.getLogger(StoreRetry.class);

    @FunctionalInterface
    public interface StoreOperation<T> {
        T execute() throws IOException;
    }

    private final int maxAttempts;
    private final long backoffMs;

    public StoreRetry(final int maxAttempts, final long backoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(final String description, final StoreOperation<T> operation) throws IOException {
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.execute();
            } catch (final NoSuchFileException | FileNotFoundException e) {
                throw e;
            } catch (final IOException e) {
                lastFailure = e;
                if (attempt < maxAttempts) {
                    logger.debug("{} failed (attempt {}/{}), retrying", description, attempt, maxAttempts, e);
                    pause(attempt);
                }
            }
        }
        logger.warn("{} failed after {} attempts", description, maxAttempts);
        throw lastFailure;
    }

    private void pause(final int attempt) throws InterruptedIOException {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs * attempt);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry store operation");
        }
    }
}
