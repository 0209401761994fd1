package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.cache.MergeCache;
import de.mirkosertic.docconsolidator.cache.MergeCacheEntry;
import de.mirkosertic.docconsolidator.fs.DocumentClassifier;
import de.mirkosertic.docconsolidator.fs.DocumentRole;
import de.mirkosertic.docconsolidator.fs.FolderSnapshot;
import de.mirkosertic.docconsolidator.hash.FolderFingerprint;
import de.mirkosertic.docconsolidator.hash.MergeOutcome;
import de.mirkosertic.docconsolidator.hash.PageDeduplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Stage 6: merge the PDFs of every folder into one deduplicated output.
 * <p>
 * The folder fingerprint of the ordered candidates is compared with the merge cache
 * sidecar first. If it matches and the output still exists, the folder is skipped
 * without touching the output. A folder without candidates loses its sidecar, and a merged
 * output left in it is reported as an open issue. The cache is updated only after a verified write in
 * which every candidate could be read.
 */
public class MergeStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(MergeStage.class);

    static final String NAME = "P6 MERGE";

    private static final Set<DocumentRole> CANDIDATE_ROLES =
            EnumSet.of(DocumentRole.EXTRACTED_RANGE, DocumentRole.SOURCE_ORIGINAL, DocumentRole.BACKUP_COPY);

    private final PageDeduplicator deduplicator;

    public MergeStage(final PageDeduplicator deduplicator) {
        this.deduplicator = deduplicator;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult run(final RunContext context) throws IOException {
        final StageCounters counters = new StageCounters(NAME, context.clock());
        final DocumentClassifier classifier = context.classifier();
        final MergeCache cache = context.mergeCache();

        for (final Path folder : FolderSnapshot.entityFolders(context.destinationRoot())) {
            try {
                final List<Path> candidates = FolderSnapshot.capture(folder).files().stream()
                        .filter(file -> CANDIDATE_ROLES.contains(classifier.classify(file)))
                        .sorted(classifier.mergeOrder())
                        .toList();
                final Path output = context.mergedOutput(folder);
                if (candidates.isEmpty()) {
                    if (cache.invalidate(folder)) {
                        counters.changed();
                    }
                    if (Files.exists(output)) {
                        context.journal().issue(NAME, folder.getFileName() + "/" + output.getFileName()
                                + " is stale, the folder has no documents left to merge");
                    }
                    continue;
                }
                counters.processed();

                final String fingerprint = FolderFingerprint.of(candidates);
                if (Files.isRegularFile(output) && cache.matches(folder, fingerprint)) {
                    logger.debug("{}: unchanged, merge skipped", folder.getFileName());
                    continue;
                }

                final MergeOutcome outcome = deduplicator.merge(candidates, output, (candidate, cause) -> {
                    context.journal().ioError(NAME, "Could not read " + candidate, cause);
                    counters.failed();
                });
                if (!outcome.outputWritten()) {
                    continue;
                }
                counters.changed();
                logger.info("{}: merged {} pages from {} files, {} duplicate pages dropped", folder.getFileName(),
                        outcome.pagesWritten(), candidates.size(), outcome.duplicatePagesSkipped());

                if (outcome.complete()) {
                    cache.save(folder, new MergeCacheEntry(folder.getFileName().toString(), fingerprint,
                            context.clock().instant()));
                }
            } catch (final IOException e) {
                context.journal().ioError(NAME, "Merging " + folder + " failed", e);
                counters.failed();
            }
        }
        return counters.result();
    }
}
