package de.mirkosertic.contentindexer.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A content file made of {@code Name: value} header lines, a blank line and a free-form body.
 * <p>
 * Header names compare case-insensitively, may repeat, and keep their order. Lines starting
 * with whitespace continue the previous header. The first line that is neither a header nor a
 * continuation ends the header block and starts the body.
 */
public final class HeaderDocument {

    private static final Pattern HEADER_LINE = Pattern.compile("^([!-9;-~]+):[ \\t]*(.*)$");

    private final List<Header> headers;
    private final String body;

    private record Header(String name, String value) {
    }

    private HeaderDocument(final List<Header> headers, final String body) {
        this.headers = headers;
        this.body = body;
    }

    public static HeaderDocument read(final Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static HeaderDocument parse(final String text) {
        final List<Header> headers = new ArrayList<>();
        final String normalized = text.replace("\r\n", "\n");

        int position = 0;
        while (position < normalized.length()) {
            final int lineEnd = normalized.indexOf('\n', position);
            final String line = lineEnd < 0 ? normalized.substring(position) : normalized.substring(position, lineEnd);
            final int next = lineEnd < 0 ? normalized.length() : lineEnd + 1;

            if (line.isEmpty()) {
                position = next;
                break;
            }
            if ((line.charAt(0) == ' ' || line.charAt(0) == '\t') && !headers.isEmpty()) {
                final Header last = headers.remove(headers.size() - 1);
                headers.add(new Header(last.name(), last.value() + " " + line.trim()));
                position = next;
                continue;
            }
            final Matcher matcher = HEADER_LINE.matcher(line);
            if (!matcher.matches()) {
                break;
            }
            headers.add(new Header(matcher.group(1), matcher.group(2).trim()));
            position = next;
        }

        return new HeaderDocument(headers, normalized.substring(Math.min(position, normalized.length())));
    }

    public Optional<String> get(final String name) {
        for (final Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return Optional.of(header.value());
            }
        }
        return Optional.empty();
    }

    public List<String> getAll(final String name) {
        final List<String> values = new ArrayList<>();
        for (final Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                values.add(header.value());
            }
        }
        return values;
    }

    public boolean has(final String name) {
        return get(name).isPresent();
    }

    /**
     * Replace all occurrences of the header with a single one at the end of the header block.
     */
    public void set(final String name, final String value) {
        remove(name);
        headers.add(new Header(name, value));
    }

    public void remove(final String name) {
        headers.removeIf(header -> header.name().equalsIgnoreCase(name));
    }

    public String getBody() {
        return body;
    }

    public String render() {
        final StringBuilder result = new StringBuilder();
        for (final Header header : headers) {
            result.append(header.name()).append(": ").append(header.value()).append('\n');
        }
        result.append('\n').append(body);
        return result.toString();
    }

    /**
     * Replace the file with the rendered document. Readers see either the old or the new file.
     */
    public void writeAtomically(final Path file) throws IOException {
        final Path directory = file.toAbsolutePath().getParent();
        final Path temp = Files.createTempFile(directory, "." + file.getFileName(), ".tmp");
        try {
            Files.writeString(temp, render(), StandardCharsets.UTF_8);
            // createTempFile uses owner-only permissions
            if (Files.exists(file) && FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(temp, Files.getPosixFilePermissions(file));
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
