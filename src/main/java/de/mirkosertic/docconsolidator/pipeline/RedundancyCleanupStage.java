package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.fs.DocumentClassifier;
import de.mirkosertic.docconsolidator.fs.FolderSnapshot;
import de.mirkosertic.docconsolidator.table.CandidateTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Stage 5: delete source originals whose document code is no longer listed in the
 * folder's candidate table. Folders without a usable table are not touched.
 */
public class RedundancyCleanupStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(RedundancyCleanupStage.class);

    static final String NAME = "P5 REDUNDANCY CLEANUP";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult run(final RunContext context) throws IOException {
        final StageCounters counters = new StageCounters(NAME, context.clock());
        final DocumentClassifier classifier = context.classifier();

        for (final Path folder : FolderSnapshot.entityFolders(context.destinationRoot())) {
            final Path tablePath = context.candidateTable(folder);
            if (!CandidateTable.exists(tablePath)) {
                continue;
            }
            counters.processed();
            try {
                final CandidateTable table = CandidateTable.load(tablePath);
                if (!table.usable()) {
                    logger.warn("Not cleaning {}, its candidate table lacks required columns", folder.getFileName());
                    continue;
                }
                final Set<String> listed = table.codes();
                for (final Path file : FolderSnapshot.capture(folder).files()) {
                    final Optional<String> code = classifier.documentCode(file.getFileName().toString());
                    if (code.isEmpty() || listed.contains(code.get())) {
                        continue;
                    }
                    try {
                        Files.delete(file);
                        counters.changed();
                        logger.info("{}: deleted redundant {}", folder.getFileName(), file.getFileName());
                    } catch (final IOException e) {
                        context.journal().ioError(NAME, "Could not delete " + file, e);
                        counters.failed();
                    }
                }
            } catch (final IOException e) {
                context.journal().ioError(NAME, "Cleaning " + folder + " failed", e);
                counters.failed();
            }
        }
        return counters.result();
    }
}
