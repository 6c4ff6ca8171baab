package de.mirkosertic.contentindexer.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprint of a file: lowercase hex SHA-256 of its bytes. The modification time
 * plays no part, so touching a file keeps its fingerprint.
 */
public final class Fingerprints {

    private static final int BUFFER_SIZE = 16 * 1024;

    private Fingerprints() {
    }

    /**
     * @throws NoSuchFileException if the file does not exist (anymore)
     */
    public static String of(final Path file) throws IOException {
        final MessageDigest digest = sha256();
        try (final InputStream input = Files.newInputStream(file)) {
            final byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = input.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
