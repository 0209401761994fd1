package de.mirkosertic.docconsolidator.pipeline;

/**
 * Counters of one stage run.
 */
public record StageResult(
        /** Stage name as used in the logs. */
        String stage,
        /** Units (entities, folders, files) the stage looked at. */
        int processed,
        /** Units the stage changed on disk or in a table. */
        int changed,
        /** Units that failed and were skipped. */
        int failed,
        /** Wall-clock time in milliseconds. */
        long elapsedMs
) {
}
