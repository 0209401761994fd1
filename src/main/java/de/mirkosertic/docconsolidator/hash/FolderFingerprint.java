package de.mirkosertic.docconsolidator.hash;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;

/**
 * Folder-scope fingerprint: SHA-256 over the ordered merge candidates.
 * For each candidate its name, its length and its bytes enter the digest, so
 * renaming, reordering, adding, removing or editing a candidate changes the result.
 */
public final class FolderFingerprint {

    private FolderFingerprint() {
    }

    public static String of(final List<Path> orderedCandidates) throws IOException {
        final MessageDigest digest = Digests.newDigest();
        for (final Path candidate : orderedCandidates) {
            digest.update(candidate.getFileName().toString().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(Long.toString(Files.size(candidate)).getBytes(StandardCharsets.US_ASCII));
            digest.update((byte) 0);
            Digests.update(digest, candidate);
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
