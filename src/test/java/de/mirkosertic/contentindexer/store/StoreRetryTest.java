package de.mirkosertic.contentindexer.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StoreRetry Tests")
class StoreRetryTest {

    @Test
    @DisplayName("Should retry transient I/O failures until the operation succeeds")
    void shouldRetryUntilSuccess() throws IOException {
        final StoreRetry retry = new StoreRetry(5, 0);
        final AtomicInteger attempts = new AtomicInteger();

        final String result = retry.execute("test", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("conflict");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("Should give up after the configured number of attempts")
    void shouldGiveUp() {
        final StoreRetry retry = new StoreRetry(3, 0);
        final AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("test", () -> {
            attempts.incrementAndGet();
            throw new IOException("conflict");
        })).isInstanceOf(IOException.class).hasMessage("conflict");
        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("Should not retry a vanished file")
    void shouldNotRetryMissingFile() {
        final StoreRetry retry = new StoreRetry(5, 0);
        final AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("test", () -> {
            attempts.incrementAndGet();
            throw new NoSuchFileException("gone.md");
        })).isInstanceOf(NoSuchFileException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    @DisplayName("Should reject fewer than one attempt")
    void shouldRejectZeroAttempts() {
        assertThatThrownBy(() -> new StoreRetry(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
