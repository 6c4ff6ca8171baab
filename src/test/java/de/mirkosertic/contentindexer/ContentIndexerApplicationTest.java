package de.mirkosertic.contentindexer;

import de.mirkosertic.contentindexer.config.ApplicationConfig;
import de.mirkosertic.contentindexer.indexer.IndexStateManager;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ContentIndexerApplication Tests")
class ContentIndexerApplicationTest {

    @TempDir
    Path tempDir;

    private Path contentDir;
    private IndexStateManager stateManager;
    private ContentIndexerApplication app;

    @BeforeEach
    void setUp() throws IOException {
        contentDir = Files.createDirectories(tempDir.resolve("content"));
        final ApplicationConfig config = ApplicationConfig.defaults(contentDir, tempDir.resolve("index"));
        config.setWaitTimeMs(0);
        config.setWatchEnabled(false);
        stateManager = new IndexStateManager(tempDir.resolve("state/index-state.yaml"));
        app = new ContentIndexerApplication(config, stateManager);
    }

    @AfterEach
    void tearDown() {
        app.shutdown();
    }

    private Path write(final String relativePath, final String content) throws IOException {
        final Path file = contentDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Scanning")
    class Scanning {

        @Test
        @DisplayName("Should index entries and categories and repair entries without an id")
        void shouldIndexContentTree() throws Exception {
            write("blog/a.md", """
                    Entry-ID: 1
                    Title: First post
                    Date: 2024-03-01 10:00:00
                    UUID: 0b5a3f4e-9d4c-4c55-9f2e-1f7c0e7c6a11

                    Hello.
                    """);
            final Path b = write("blog/b.md", """
                    Title: Second post

                    No id yet.
                    """);
            write("blog/_category.cat", """
                    Name: Blog
                    """);

            assertThat(app.init()).isFalse();
            app.scan();
            assertThat(app.awaitIdle(Duration.ofSeconds(10))).isTrue();

            final IndexerStatus status = app.status();
            assertThat(status.entryCount()).isEqualTo(2);
            assertThat(status.categoryCount()).isEqualTo(1);
            assertThat(status.fingerprintCount()).isEqualTo(3);
            assertThat(status.statistics().fixups()).isEqualTo(1);
            assertThat(status.statistics().terminalFailures()).isZero();
            assertThat(Files.readString(b)).contains("Entry-ID: 2");
            assertThat(stateManager.load())
                    .hasValueSatisfying(state -> assertThat(state.contentDirectory())
                            .isEqualTo(contentDir.toAbsolutePath().normalize().toString()));
        }

        @Test
        @DisplayName("A rescan should prune deleted files and leave unchanged files alone")
        void rescanShouldPruneDeletedFiles() throws Exception {
            final Path a = write("blog/a.md", "Entry-ID: 1\nTitle: A\n\nA");
            write("blog/c.md", "Entry-ID: 3\nTitle: C\n\nC");
            app.init();
            app.scan();
            assertThat(app.awaitIdle(Duration.ofSeconds(10))).isTrue();
            final long processedAfterFirstScan = app.status().statistics().processed();

            Files.delete(a);
            app.scan();
            assertThat(app.awaitIdle(Duration.ofSeconds(10))).isTrue();

            final IndexerStatus status = app.status();
            assertThat(status.entryCount()).isEqualTo(1);
            assertThat(status.fingerprintCount()).isEqualTo(1);
            assertThat(status.statistics().processed()).isEqualTo(processedAfterFirstScan);
            assertThat(status.statistics().pruned()).isGreaterThanOrEqualTo(2);
        }

        @Test
        @DisplayName("Should refuse to start without a content directory")
        void shouldFailWithoutContentDirectory() throws IOException {
            Files.delete(contentDir);

            assertThatThrownBy(() -> app.init())
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("Content directory does not exist");
        }
    }

    @Nested
    @DisplayName("Status")
    class Status {

        @Test
        @DisplayName("Should report only static values before the index is opened")
        void shouldReportPartialStatusBeforeInit() {
            final IndexerStatus status = app.status();

            assertThat(status.contentDirectory()).isEqualTo(contentDir.toAbsolutePath().normalize().toString());
            assertThat(status.entryCount()).isNull();
            assertThat(status.toJson())
                    .contains("\"contentDirectory\"")
                    .doesNotContain("entryCount");
        }
    }

    @Nested
    @DisplayName("Command line")
    class CommandLine {

        @Test
        @DisplayName("Should default to watch mode and parse commands case-insensitively")
        void shouldParseMode() {
            assertThat(ContentIndexerApplication.Mode.fromArgs(new String[0]))
                    .isEqualTo(ContentIndexerApplication.Mode.WATCH);
            assertThat(ContentIndexerApplication.Mode.fromArgs(new String[]{"Scan"}))
                    .isEqualTo(ContentIndexerApplication.Mode.SCAN);
            assertThat(ContentIndexerApplication.Mode.fromArgs(new String[]{"status"}))
                    .isEqualTo(ContentIndexerApplication.Mode.STATUS);
        }

        @Test
        @DisplayName("Should reject unknown commands")
        void shouldRejectUnknownCommand() {
            assertThatThrownBy(() -> ContentIndexerApplication.Mode.fromArgs(new String[]{"index"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("index");
        }
    }
}
