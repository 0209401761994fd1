package de.mirkosertic.docconsolidator.fs;

import de.mirkosertic.docconsolidator.hash.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies files into a destination without ever overwriting a distinct existing file.
 * <p>
 * Candidate names are tried in order: {@code name.ext}, {@code name_dup1.ext},
 * {@code name_dup2.ext}, ... A candidate that already holds the same file (see
 * {@link DuplicateCheck}) is returned as is; the first unused candidate receives
 * the copy. Bytes and timestamps are written to a hidden {@code .part} sibling
 * first and moved into place afterwards, so an interrupted transfer never leaves
 * a truncated file under a real name.
 */
public class SafeCopier {

    private static final Logger logger = LoggerFactory.getLogger(SafeCopier.class);

    static final String DUP_SUFFIX = "_dup";
    private static final String PART_SUFFIX = ".part";

    private final DuplicateCheck duplicateCheck;

    public SafeCopier(final DuplicateCheck duplicateCheck) {
        this.duplicateCheck = duplicateCheck;
    }

    /**
     * Copy {@code source} to {@code destination} or to the next free {@code _dupN} name.
     *
     * @return the path that now holds the source content
     * @throws NoSuchFileException if the source does not exist
     * @throws IOException         if the copy fails
     */
    public Path copy(final Path source, final Path destination) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(source.toString());
        }

        final Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        final String fileName = destination.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        final String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        final String extension = dot > 0 ? fileName.substring(dot) : "";

        Path candidate = destination;
        int counter = 1;
        while (Files.exists(candidate)) {
            if (Files.isRegularFile(candidate) && isSameFile(source, candidate)) {
                logger.debug("Already present, not copying: {} -> {}", source, candidate);
                return candidate;
            }
            candidate = destination.resolveSibling(base + DUP_SUFFIX + counter + extension);
            counter++;
        }

        transfer(source, candidate);
        logger.debug("Copied {} -> {}", source, candidate);
        return candidate;
    }

    boolean isSameFile(final Path source, final Path existing) throws IOException {
        if (Files.size(source) != Files.size(existing)) {
            return false;
        }
        if (duplicateCheck == DuplicateCheck.SIZE) {
            return true;
        }
        return Digests.sha256Hex(source).equals(Digests.sha256Hex(existing));
    }

    private void transfer(final Path source, final Path target) throws IOException {
        final Path part = target.resolveSibling("." + target.getFileName() + PART_SUFFIX);
        try {
            Files.copy(source, part, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            try {
                Files.move(part, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(part, target);
            }
        } catch (final IOException e) {
            try {
                Files.deleteIfExists(part);
            } catch (final IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw e;
        }
    }
}
