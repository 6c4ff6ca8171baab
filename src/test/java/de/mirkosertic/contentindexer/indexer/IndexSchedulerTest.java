package de.mirkosertic.contentindexer.indexer;

import de.mirkosertic.contentindexer.scan.ScanDispatcher;
import de.mirkosertic.contentindexer.scan.ScanOutcome;
import de.mirkosertic.contentindexer.store.FingerprintStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for batching, deduplication and the fixup protocol of the IndexScheduler.
 */
@DisplayName("IndexScheduler Tests")
class IndexSchedulerTest {

    @TempDir
    Path contentDir;

    private ScanDispatcher dispatcher;
    private FingerprintStore fingerprintStore;
    private IndexStatisticsTracker statisticsTracker;
    private IndexExecutorService executor;
    private IndexScheduler scheduler;

    @BeforeEach
    void setUp() {
        dispatcher = mock(ScanDispatcher.class);
        fingerprintStore = mock(FingerprintStore.class);
        statisticsTracker = new IndexStatisticsTracker();
        executor = new IndexExecutorService();
        when(dispatcher.scanFile(any(), any(), anyBoolean())).thenReturn(ScanOutcome.SUCCESS);
        scheduler = newScheduler(Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private IndexScheduler newScheduler(final Duration waitTime) {
        return new IndexScheduler(executor, dispatcher, fingerprintStore, statisticsTracker, waitTime);
    }

    private Path write(final String relativePath) throws IOException {
        final Path file = contentDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "Entry-ID: 1\n\n" + relativePath);
        return file;
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("Should process identical enqueues only once")
        void shouldDeduplicateIdenticalItems() throws Exception {
            final Path file = write("posts/a.md");

            for (int i = 0; i < 5; i++) {
                scheduler.enqueue(file, "posts/a.md", false);
            }

            verify(dispatcher, timeout(2000).times(1)).scanFile(file, "posts/a.md", false);
            verify(dispatcher, after(300).times(1)).scanFile(any(), any(), anyBoolean());
            verify(fingerprintStore, timeout(2000).times(1)).set(file);
        }

        @Test
        @DisplayName("Should process a burst of changes in a single pass with a single commit")
        void shouldBatchBurstIntoSinglePass() throws Exception {
            final Path a = write("posts/a.md");
            final Path b = write("posts/b.md");
            final Path c = write("posts/c.md");

            scheduler.enqueue(a, "posts/a.md", false);
            scheduler.enqueue(b, "posts/b.md", false);
            scheduler.enqueue(c, "posts/c.md", false);

            assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
            verify(dispatcher).scanFile(a, "posts/a.md", false);
            verify(dispatcher).scanFile(b, "posts/b.md", false);
            verify(dispatcher).scanFile(c, "posts/c.md", false);
            verify(fingerprintStore).commit();
            assertThat(statisticsTracker.getStatistics().passes()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should wait for the debounce delay before processing")
        void shouldDebounce() throws Exception {
            final Path file = write("posts/a.md");

            scheduler.enqueue(file, "posts/a.md", false);

            verify(dispatcher, after(100).never()).scanFile(any(), any(), anyBoolean());
            verify(dispatcher, timeout(2000)).scanFile(file, "posts/a.md", false);
        }

        @Test
        @DisplayName("Should treat normal and fixup requests for the same file as distinct items")
        void shouldKeepFixupFlagDistinct() throws Exception {
            final Path file = write("posts/a.md");

            scheduler.enqueue(file, "posts/a.md", false);
            scheduler.enqueue(file, "posts/a.md", true);

            verify(dispatcher, timeout(2000)).scanFile(file, "posts/a.md", false);
            verify(dispatcher, timeout(2000)).scanFile(file, "posts/a.md", true);
        }

        @Test
        @DisplayName("Should not lose items enqueued concurrently from many threads")
        void shouldNotLoseConcurrentItems() throws Exception {
            scheduler.shutdown();
            executor = new IndexExecutorService();
            scheduler = newScheduler(Duration.ofMillis(5));

            final List<Path> files = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                files.add(write("bulk/" + i + ".md"));
            }
            final Set<Path> scanned = ConcurrentHashMap.newKeySet();
            when(dispatcher.scanFile(any(), any(), anyBoolean())).thenAnswer(invocation -> {
                scanned.add(invocation.getArgument(0));
                return ScanOutcome.SUCCESS;
            });

            final ExecutorService producers = Executors.newFixedThreadPool(8);
            final CountDownLatch start = new CountDownLatch(1);
            for (int t = 0; t < 8; t++) {
                final int offset = t;
                producers.execute(() -> {
                    try {
                        start.await();
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = offset; i < files.size(); i += 8) {
                        scheduler.enqueue(files.get(i), null, false);
                        if (i % 16 == 0) {
                            Thread.yield();
                        }
                    }
                });
            }
            start.countDown();
            producers.shutdown();
            assertThat(producers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            assertThat(scheduler.awaitIdle(Duration.ofSeconds(10))).isTrue();
            assertThat(scanned).containsExactlyInAnyOrderElementsOf(files);
        }

        @Test
        @DisplayName("Should pick up an item enqueued while a pass is running")
        void shouldPickUpItemsEnqueuedDuringPass() throws Exception {
            final Path a = write("posts/a.md");
            final Path b = write("posts/b.md");
            when(dispatcher.scanFile(a, "posts/a.md", false)).thenAnswer(invocation -> {
                scheduler.enqueue(b, "posts/b.md", false);
                return ScanOutcome.SUCCESS;
            });

            scheduler.enqueue(a, "posts/a.md", false);

            verify(dispatcher, timeout(2000)).scanFile(b, "posts/b.md", false);
        }
    }

    @Nested
    @DisplayName("Fixup protocol")
    class FixupProtocol {

        @Test
        @DisplayName("Should retry a transient failure exactly once in fixup mode")
        void shouldRetryOnceInFixupMode() throws Exception {
            final Path file = write("posts/b.md");
            when(dispatcher.scanFile(file, "posts/b.md", false)).thenReturn(ScanOutcome.TRANSIENT_FAILURE);
            when(dispatcher.scanFile(file, "posts/b.md", true)).thenReturn(ScanOutcome.SUCCESS);

            scheduler.enqueue(file, "posts/b.md", false);

            verify(dispatcher, timeout(2000)).scanFile(file, "posts/b.md", true);
            verify(dispatcher, after(300).times(2)).scanFile(eq(file), anyString(), anyBoolean());
            verify(fingerprintStore).set(file);
            assertThat(statisticsTracker.getStatistics().fixups()).isEqualTo(1);
            assertThat(statisticsTracker.getStatistics().terminalFailures()).isZero();
        }

        @Test
        @DisplayName("A failing fixup should be terminal and record the fingerprint")
        void failingFixupShouldBeTerminal() throws Exception {
            final Path file = write("posts/broken.md");
            when(dispatcher.scanFile(eq(file), anyString(), anyBoolean())).thenReturn(ScanOutcome.TRANSIENT_FAILURE);

            scheduler.enqueue(file, "posts/broken.md", false);

            verify(dispatcher, timeout(2000)).scanFile(file, "posts/broken.md", true);
            verify(dispatcher, after(300).times(2)).scanFile(eq(file), anyString(), anyBoolean());
            verify(fingerprintStore).set(file);
            assertThat(statisticsTracker.getStatistics().terminalFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("Scenario: a.md indexes, b.md raises first and succeeds on fixup")
        void shouldIndexBothFilesWhenOneNeedsFixup() throws Exception {
            final Path a = write("posts/a.md");
            final Path b = write("posts/b.md");
            when(dispatcher.scanFile(b, "posts/b.md", false)).thenThrow(new IllegalStateException("missing header"));
            when(dispatcher.scanFile(b, "posts/b.md", true)).thenReturn(ScanOutcome.SUCCESS);

            scheduler.enqueue(a, "posts/a.md", false);
            scheduler.enqueue(b, "posts/b.md", false);

            assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
            verify(dispatcher).scanFile(a, "posts/a.md", false);
            verify(dispatcher, times(2)).scanFile(eq(b), anyString(), anyBoolean());
            verify(fingerprintStore).set(a);
            verify(fingerprintStore).set(b);
        }

        @Test
        @DisplayName("Should treat a store failure like a transient failure")
        void shouldTreatStoreFailureAsTransient() throws Exception {
            final Path file = write("posts/a.md");
            doThrow(new IOException("write conflict")).doReturn(true).when(fingerprintStore).set(file);

            final ScanOutcome outcome = scheduler.processOne(new WorkItem(file, "posts/a.md", false));

            assertThat(outcome).isEqualTo(ScanOutcome.TRANSIENT_FAILURE);
            verify(dispatcher, timeout(2000)).scanFile(file, "posts/a.md", true);
        }
    }

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("Should forget a file that no longer exists without scanning it")
        void shouldForgetMissingFile() throws Exception {
            final Path file = contentDir.resolve("posts/gone.md");

            scheduler.enqueue(file, "posts/gone.md", false);

            verify(fingerprintStore, timeout(2000)).forget(file);
            verify(dispatcher, never()).scanFile(any(), any(), anyBoolean());
            assertThat(statisticsTracker.getStatistics().missing()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should leave the fingerprint untouched for declined and skipped files")
        void shouldNotFingerprintDeclinedFiles() throws Exception {
            final Path declined = write("posts/empty.md");
            final Path skipped = write("images/photo.png");
            when(dispatcher.scanFile(declined, "posts/empty.md", false)).thenReturn(ScanOutcome.NOT_APPLICABLE);
            when(dispatcher.scanFile(skipped, "images/photo.png", false)).thenReturn(ScanOutcome.SKIPPED);

            assertThat(scheduler.processOne(new WorkItem(declined, "posts/empty.md", false)))
                    .isEqualTo(ScanOutcome.NOT_APPLICABLE);
            assertThat(scheduler.processOne(new WorkItem(skipped, "images/photo.png", false)))
                    .isEqualTo(ScanOutcome.SKIPPED);

            verify(fingerprintStore, never()).set(any(Path.class));
            assertThat(statisticsTracker.getStatistics().skipped()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Introspection and shutdown")
    class Lifecycle {

        @Test
        @DisplayName("Queue depth should count pending items and the scheduled pass")
        void queueDepthShouldCountPendingWork() throws Exception {
            scheduler.shutdown();
            executor = new IndexExecutorService();
            scheduler = newScheduler(Duration.ofSeconds(30));

            scheduler.enqueue(write("posts/a.md"), "posts/a.md", false);
            scheduler.enqueue(write("posts/b.md"), "posts/b.md", false);

            assertThat(scheduler.queueDepth()).isEqualTo(OptionalInt.of(3));
        }

        @Test
        @DisplayName("Should ignore enqueues after shutdown")
        void shouldIgnoreEnqueueAfterShutdown() throws Exception {
            final Path file = write("posts/a.md");
            scheduler.shutdown();

            scheduler.enqueue(file, "posts/a.md", false);

            verify(dispatcher, after(400).never()).scanFile(any(), any(), anyBoolean());
            assertThat(scheduler.queueDepth()).isEmpty();
        }

        @Test
        @DisplayName("Should process immediately with a zero wait time")
        void shouldProcessWithZeroWaitTime() throws Exception {
            scheduler.shutdown();
            executor = new IndexExecutorService();
            scheduler = newScheduler(Duration.ZERO);
            final Path file = write("posts/a.md");

            scheduler.enqueue(file, "posts/a.md", false);

            assertThat(scheduler.awaitIdle(Duration.ofSeconds(2))).isTrue();
            verify(dispatcher).scanFile(file, "posts/a.md", false);
        }
    }
}
