package de.mirkosertic.docconsolidator.hash;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one deduplicating merge pass over a folder.
 */
public record MergeOutcome(
        /** Pages written to the merged output. */
        int pagesWritten,
        /** Pages skipped because an earlier page had the same fingerprint. */
        int duplicatePagesSkipped,
        /** Candidates that could not be opened and contributed nothing. */
        List<Path> failedCandidates,
        /** Whether a verified merged output was moved into place. */
        boolean outputWritten
) {
    public MergeOutcome {
        failedCandidates = List.copyOf(failedCandidates);
    }

    public boolean complete() {
        return outputWritten && failedCandidates.isEmpty();
    }
}
