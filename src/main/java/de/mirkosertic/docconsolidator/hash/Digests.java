package de.mirkosertic.docconsolidator.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers shared by the fingerprinting code.
 */
public final class Digests {

    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 64 * 1024;

    private Digests() {
    }

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " algorithm not found", e);
        }
    }

    public static String sha256Hex(final byte[] data) {
        return HexFormat.of().formatHex(newDigest().digest(data));
    }

    public static String sha256Hex(final Path file) throws IOException {
        final MessageDigest digest = newDigest();
        update(digest, file);
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Stream the file's bytes into the digest.
     */
    public static void update(final MessageDigest digest, final Path file) throws IOException {
        final byte[] buffer = new byte[BUFFER_SIZE];
        try (final InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
    }
}
