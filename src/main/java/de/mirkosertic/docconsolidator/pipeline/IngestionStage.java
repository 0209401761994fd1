package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.fs.FolderSnapshot;
import de.mirkosertic.docconsolidator.registry.Entity;
import de.mirkosertic.docconsolidator.registry.EntityStatus;
import de.mirkosertic.docconsolidator.registry.ReconciliationResult;
import de.mirkosertic.docconsolidator.registry.RenameReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Stage 1: reconcile folder names with the entity table, then fetch every entity's
 * source document into its folder and record whether it was found.
 */
public class IngestionStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(IngestionStage.class);

    static final String NAME = "P1 INGESTION";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult run(final RunContext context) throws IOException {
        final StageCounters counters = new StageCounters(NAME, context.clock());
        final RunJournal journal = context.journal();
        final List<Entity> entities = context.entityTable().entities();

        final ReconciliationResult reconciliation =
                new RenameReconciler(context.copier()).reconcile(entities, context.destinationRoot());
        counters.changed(reconciliation.renamedCount() + reconciliation.mergedCount() + reconciliation.createdCount());
        for (final String failure : reconciliation.failures()) {
            journal.ioError(NAME, failure);
            counters.failed();
        }
        for (final String issue : reconciliation.openIssues()) {
            journal.issue(NAME, issue);
        }

        for (final Entity entity : entities) {
            final String folderName = entity.desiredFolderName();
            if (folderName.isEmpty() || !entity.hasSourceReference()) {
                continue;
            }
            counters.processed();
            final Path folder = context.destinationRoot().resolve(folderName);
            try {
                Files.createDirectories(folder);
                final Optional<Path> source = context.sourceStore().find(entity.sourceReference());
                if (source.isEmpty()) {
                    entity.status(EntityStatus.MISSING);
                    journal.lookupError(NAME, entity.sourceReference() + " for folder " + folderName);
                    continue;
                }
                final FolderSnapshot before = FolderSnapshot.capture(folder);
                final Path copied = context.copier().copy(source.get(), folder.resolve(source.get().getFileName().toString()));
                entity.status(EntityStatus.OK);
                if (!before.containsFile(copied.getFileName().toString())) {
                    counters.changed();
                    logger.info("COPIED {} -> {}/{}", source.get().getFileName(), folderName, copied.getFileName());
                }
            } catch (final NoSuchFileException e) {
                entity.status(EntityStatus.MISSING);
                journal.lookupError(NAME, entity.sourceReference() + " vanished from the source store");
            } catch (final IOException e) {
                entity.status(EntityStatus.MISSING);
                journal.ioError(NAME, "Copying " + entity.sourceReference() + " into " + folderName + " failed", e);
                counters.failed();
            }
        }

        try {
            context.entityTable().save();
        } catch (final IOException e) {
            journal.ioError(NAME, "Saving entity table " + context.entityTable().file() + " failed", e);
            counters.failed();
        }
        return counters.result();
    }
}
