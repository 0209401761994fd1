package de.mirkosertic.docconsolidator.cache;

import java.time.Instant;

/**
 * Persisted state of the last successful merge of one folder.
 */
public record MergeCacheEntry(
        /** Name of the folder the entry belongs to. */
        String folder,
        /** Folder-scope fingerprint of the candidates that produced the merged output. */
        String fingerprint,
        /** When the merged output was written and verified. */
        Instant timestamp
) {
}
