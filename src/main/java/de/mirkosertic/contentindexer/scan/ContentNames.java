package de.mirkosertic.contentindexer.scan;

import org.jspecify.annotations.Nullable;

import java.io.File;
import java.nio.file.Path;

/**
 * Naming conventions shared by the scanners: titles guessed from file names, URL slugs, and
 * categories taken from the directory part of a relative path.
 */
public final class ContentNames {

    private ContentNames() {
    }

    /**
     * {@code my_first-post.md} becomes {@code My First Post}.
     */
    public static String guessTitle(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        final String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        final StringBuilder title = new StringBuilder();
        for (final String word : base.split("[ _-]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            // a letter after a non-letter starts a new capitalized run: post2go -> Post2Go
            boolean previousIsLetter = false;
            for (final char ch : word.toCharArray()) {
                title.append(previousIsLetter ? Character.toLowerCase(ch) : Character.toUpperCase(ch));
                previousIsLetter = Character.isLetter(ch);
            }
        }
        return title.toString();
    }

    public static String makeSlug(final String title) {
        return title.strip().replaceAll("[^a-zA-Z0-9]+", "-");
    }

    /**
     * Relative path with forward slashes; the file name alone when no relative path is known.
     */
    public static String relativeName(final Path fullPath, @Nullable final String relativePath) {
        final String relative = relativePath != null ? relativePath : fullPath.getFileName().toString();
        return relative.replace(File.separatorChar, '/');
    }

    /**
     * Directory part of a forward-slash relative path, empty for files at the root.
     */
    public static String categoryOf(final String relativeName) {
        final int slash = relativeName.lastIndexOf('/');
        return slash < 0 ? "" : relativeName.substring(0, slash);
    }

    public static String baseName(final String relativeName) {
        final int slash = relativeName.lastIndexOf('/');
        return slash < 0 ? relativeName : relativeName.substring(slash + 1);
    }
}
