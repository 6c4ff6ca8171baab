package de.mirkosertic.contentindexer.scan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeaderDocument Tests")
class HeaderDocumentTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should split headers from the body at the first blank line")
    void shouldSplitHeadersAndBody() {
        final HeaderDocument doc = HeaderDocument.parse("Title: Hello\nCategory: blog\n\nFirst line\n\nSecond: not a header\n");

        assertThat(doc.get("Title")).contains("Hello");
        assertThat(doc.get("Category")).contains("blog");
        assertThat(doc.has("Second")).isFalse();
        assertThat(doc.getBody()).isEqualTo("First line\n\nSecond: not a header\n");
    }

    @Test
    @DisplayName("Header names should match case-insensitively")
    void shouldMatchNamesIgnoringCase() {
        final HeaderDocument doc = HeaderDocument.parse("entry-id: 12\n\nbody");

        assertThat(doc.get("Entry-ID")).contains("12");
    }

    @Test
    @DisplayName("Repeated headers should keep their order")
    void shouldKeepRepeatedHeaders() {
        final HeaderDocument doc = HeaderDocument.parse("Path-Alias: /old\nPath-Alias: /older\n\n");

        assertThat(doc.getAll("Path-Alias")).containsExactly("/old", "/older");
        assertThat(doc.get("Path-Alias")).contains("/old");
    }

    @Test
    @DisplayName("Indented lines should continue the previous header")
    void shouldJoinContinuationLines() {
        final HeaderDocument doc = HeaderDocument.parse("Title: A rather\n  long title\n\nbody");

        assertThat(doc.get("Title")).contains("A rather long title");
    }

    @Test
    @DisplayName("A file without headers should be all body")
    void shouldTreatHeaderlessTextAsBody() {
        final HeaderDocument doc = HeaderDocument.parse("Just some text\nwithout headers");

        assertThat(doc.has("Title")).isFalse();
        assertThat(doc.getBody()).isEqualTo("Just some text\nwithout headers");
    }

    @Test
    @DisplayName("Set should replace existing values and render them back")
    void shouldReplaceAndRender() {
        final HeaderDocument doc = HeaderDocument.parse("Title: Hello\nDate: old\n\nbody\n");

        doc.set("date", "2024-01-01T00:00:00Z");
        doc.set("Entry-ID", "7");

        assertThat(doc.render()).isEqualTo("Title: Hello\ndate: 2024-01-01T00:00:00Z\nEntry-ID: 7\n\nbody\n");
    }

    @Test
    @DisplayName("Atomic write should replace the file and leave no temp files behind")
    void shouldWriteAtomically() throws IOException {
        final Path file = tempDir.resolve("post.md");
        Files.writeString(file, "Title: Hello\n\nbody");
        final HeaderDocument doc = HeaderDocument.read(file);
        doc.set("Entry-ID", "3");

        doc.writeAtomically(file);

        assertThat(Files.readString(file)).isEqualTo("Title: Hello\nEntry-ID: 3\n\nbody");
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }
}
