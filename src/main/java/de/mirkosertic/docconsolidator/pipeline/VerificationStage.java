package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.fs.DocumentClassifier;
import de.mirkosertic.docconsolidator.fs.FolderSnapshot;
import de.mirkosertic.docconsolidator.registry.Entity;
import de.mirkosertic.docconsolidator.registry.EntityStatus;
import de.mirkosertic.docconsolidator.table.CandidateRow;
import de.mirkosertic.docconsolidator.table.CandidateTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stage 7: mark each candidate table row OK or MISSING depending on whether its source
 * original is still in the folder, flag entities reported OK whose folder is empty, and
 * remove empty folders that no entity names.
 */
public class VerificationStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(VerificationStage.class);

    static final String NAME = "P7 VERIFICATION";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult run(final RunContext context) throws IOException {
        final StageCounters counters = new StageCounters(NAME, context.clock());
        final List<Path> folders = FolderSnapshot.entityFolders(context.destinationRoot());

        for (final Path folder : folders) {
            final Path tablePath = context.candidateTable(folder);
            if (!CandidateTable.exists(tablePath)) {
                continue;
            }
            counters.processed();
            try {
                verifyCandidates(context, folder, tablePath, counters);
            } catch (final IOException e) {
                context.journal().ioError(NAME, "Verifying " + tablePath + " failed", e);
                counters.failed();
            }
        }

        final Set<String> named = new HashSet<>();
        for (final Entity entity : context.entityTable().entities()) {
            final String folderName = entity.desiredFolderName();
            if (folderName.isEmpty()) {
                continue;
            }
            named.add(folderName);
            if (entity.status() == EntityStatus.OK) {
                final Path folder = context.destinationRoot().resolve(folderName);
                if (!Files.isDirectory(folder) || FolderSnapshot.capture(folder).isEmpty()) {
                    context.journal().issue(NAME, "Entity " + folderName + " is OK but its folder is missing or empty");
                }
            }
        }

        for (final Path folder : folders) {
            if (named.contains(folder.getFileName().toString())) {
                continue;
            }
            try {
                if (Files.isDirectory(folder) && FolderSnapshot.capture(folder).isEmpty()) {
                    Files.delete(folder);
                    counters.changed();
                    logger.info("DELETED empty untracked folder: {}", folder.getFileName());
                }
            } catch (final IOException e) {
                context.journal().ioError(NAME, "Could not remove empty folder " + folder, e);
                counters.failed();
            }
        }
        return counters.result();
    }

    private static void verifyCandidates(final RunContext context, final Path folder, final Path tablePath,
                                         final StageCounters counters) throws IOException {
        final CandidateTable table = CandidateTable.load(tablePath);
        if (!table.usable()) {
            return;
        }
        final DocumentClassifier classifier = context.classifier();
        final Set<String> present = new HashSet<>();
        for (final Path file : FolderSnapshot.capture(folder).files()) {
            classifier.documentCode(file.getFileName().toString()).ifPresent(present::add);
        }

        final List<CandidateRow> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            final CandidateRow row = rows.get(i);
            final EntityStatus status = present.contains(row.code()) ? EntityStatus.OK : EntityStatus.MISSING;
            if (table.updateStatus(i, status) && status == EntityStatus.MISSING) {
                logger.info("{}: {} is MISSING", folder.getFileName(), row.code());
            }
        }
        if (table.isDirty()) {
            table.save();
            counters.changed();
        }
    }
}
