package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.fs.DocumentClassifier;
import de.mirkosertic.docconsolidator.fs.FolderSnapshot;
import de.mirkosertic.docconsolidator.table.CandidateTable;
import de.mirkosertic.docconsolidator.table.CandidateTableSchema;
import de.mirkosertic.docconsolidator.table.TableFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stage 2: record the document codes found in every folder in the folder's candidate
 * table, together with the master document pages the reference index lists for them.
 * Existing rows are kept as they are; a table without new codes is not rewritten.
 */
public class CandidateTableStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(CandidateTableStage.class);

    static final String NAME = "P2 CANDIDATE TABLES";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult run(final RunContext context) throws IOException {
        final StageCounters counters = new StageCounters(NAME, context.clock());
        final DocumentClassifier classifier = context.classifier();

        for (final Path folder : FolderSnapshot.entityFolders(context.destinationRoot())) {
            counters.processed();
            final Path tablePath = context.candidateTable(folder);
            try {
                final Set<String> codes = new TreeSet<>();
                for (final Path file : FolderSnapshot.capture(folder).files()) {
                    classifier.documentCode(file.getFileName().toString()).ifPresent(codes::add);
                }
                if (codes.isEmpty()) {
                    logger.debug("No document codes in {}", folder.getFileName());
                    continue;
                }

                final CandidateTable table = CandidateTable.loadOrCreate(tablePath);
                for (final TableFormatException problem : table.formatProblems()) {
                    context.journal().formatError(NAME, tablePath, problem);
                }
                if (!table.usable()) {
                    counters.failed();
                    continue;
                }

                for (final String code : codes) {
                    if (!table.contains(code)) {
                        final String pages = CandidateTableSchema.formatPages(context.referenceIndex().pagesFor(code));
                        table.append(code, pages);
                        logger.info("{}: new code {} -> pages [{}]", folder.getFileName(), code, pages);
                    }
                }
                if (table.isDirty()) {
                    table.save();
                    counters.changed();
                }
            } catch (final IOException e) {
                context.journal().ioError(NAME, "Updating " + tablePath + " failed", e);
                counters.failed();
            }
        }
        return counters.result();
    }
}
