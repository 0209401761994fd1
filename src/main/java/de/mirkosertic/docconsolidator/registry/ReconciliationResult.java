package de.mirkosertic.docconsolidator.registry;

import java.util.List;

/**
 * Immutable result of a rename reconciliation pass over the destination root.
 */
public record ReconciliationResult(
        /** Folders renamed with a single directory move. */
        int renamedCount,
        /** Stale folders whose files were moved into an already existing desired folder. */
        int mergedCount,
        /** Desired folders created because neither name existed. */
        int createdCount,
        /** Files moved during folder merges. */
        int filesMoved,
        /** Entities whose history name was advanced to the desired name. */
        int historiesUpdated,
        /** Stale folders left on disk for operator review. */
        List<String> openIssues,
        /** Entities that failed with an I/O error and keep their history for the next run. */
        List<String> failures,
        /** Wall-clock time in milliseconds spent performing the reconciliation. */
        long reconciliationTimeMs
) {
    public ReconciliationResult {
        openIssues = List.copyOf(openIssues);
        failures = List.copyOf(failures);
    }

    /** Whether the pass touched the file system at all. */
    public boolean changedAnything() {
        return renamedCount > 0 || mergedCount > 0 || createdCount > 0 || filesMoved > 0;
    }
}
