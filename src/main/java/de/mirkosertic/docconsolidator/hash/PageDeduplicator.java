package de.mirkosertic.docconsolidator.hash;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges PDFs page by page, keeping only the first occurrence of every page fingerprint.
 * <p>
 * Candidates are read in the given order and their pages in document order. The result
 * is saved to a hidden temporary sibling, reopened to check its page count and then moved
 * over the output, so a failed merge leaves the previous output untouched.
 */
public class PageDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(PageDeduplicator.class);

    private final PageFingerprinter fingerprinter;

    public PageDeduplicator(final PageFingerprinter fingerprinter) {
        this.fingerprinter = fingerprinter;
    }

    /**
     * @param orderedCandidates the PDFs to merge, in merge order
     * @param output            the merged file to (re)write
     * @param failureListener   told about every candidate that cannot be read
     * @throws IOException if the merged output cannot be written or does not verify
     */
    public MergeOutcome merge(final List<Path> orderedCandidates, final Path output,
                              final CandidateFailureListener failureListener) throws IOException {
        final Set<String> seen = new HashSet<>();
        final List<Path> failed = new ArrayList<>();
        final List<PDDocument> sources = new ArrayList<>();
        int written = 0;
        int skipped = 0;

        try (final PDDocument target = new PDDocument()) {
            for (final Path candidate : orderedCandidates) {
                final PDDocument source;
                try {
                    source = Loader.loadPDF(candidate.toFile());
                } catch (final IOException e) {
                    failed.add(candidate);
                    failureListener.candidateFailed(candidate, e);
                    continue;
                }
                sources.add(source);

                try {
                    for (int i = 0; i < source.getNumberOfPages(); i++) {
                        final String fingerprint = fingerprinter.fingerprint(source, i);
                        if (seen.add(fingerprint)) {
                            final PDPage page = source.getPage(i);
                            target.importPage(page);
                            written++;
                        } else {
                            logger.debug("Skipping duplicate page {} of {}", i + 1, candidate.getFileName());
                            skipped++;
                        }
                    }
                } catch (final IOException e) {
                    failed.add(candidate);
                    failureListener.candidateFailed(candidate, e);
                }
            }

            if (written == 0) {
                return new MergeOutcome(0, skipped, failed, false);
            }

            final Path temp = output.resolveSibling("." + output.getFileName() + ".tmp");
            try {
                target.save(temp.toFile());
                verifyPageCount(temp, written);
                moveIntoPlace(temp, output);
            } catch (final IOException e) {
                Files.deleteIfExists(temp);
                throw e;
            }
        } finally {
            closeAll(sources);
        }

        logger.debug("Merged {} pages into {}, {} duplicates skipped", written, output, skipped);
        return new MergeOutcome(written, skipped, failed, true);
    }

    private static void verifyPageCount(final Path file, final int expected) throws IOException {
        try (final PDDocument reopened = Loader.loadPDF(file.toFile())) {
            final int actual = reopened.getNumberOfPages();
            if (actual != expected) {
                throw new IOException("Merged output " + file + " has " + actual + " pages, expected " + expected);
            }
        }
    }

    private static void moveIntoPlace(final Path temp, final Path output) throws IOException {
        try {
            Files.move(temp, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void closeAll(final List<PDDocument> documents) {
        for (final PDDocument document : documents) {
            try {
                document.close();
            } catch (final IOException e) {
                logger.warn("Failed to close source document", e);
            }
        }
    }

    /**
     * Receives candidates that are skipped because they cannot be read.
     */
    @FunctionalInterface
    public interface CandidateFailureListener {
        void candidateFailed(Path candidate, IOException cause);
    }
}
