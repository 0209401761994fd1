package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.fs.DocumentClassifier;
import de.mirkosertic.docconsolidator.fs.DocumentRole;
import de.mirkosertic.docconsolidator.fs.FolderSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Stage 4: give every source original and extracted page a duplicate carrying the
 * backup marker, next to it in the same folder.
 */
public class BackupStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(BackupStage.class);

    static final String NAME = "P4 BACKUPS";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult run(final RunContext context) throws IOException {
        final StageCounters counters = new StageCounters(NAME, context.clock());
        final DocumentClassifier classifier = context.classifier();

        for (final Path folder : FolderSnapshot.entityFolders(context.destinationRoot())) {
            final FolderSnapshot snapshot;
            try {
                snapshot = FolderSnapshot.capture(folder);
            } catch (final IOException e) {
                context.journal().ioError(NAME, "Listing " + folder + " failed", e);
                counters.failed();
                continue;
            }
            for (final Path file : snapshot.files()) {
                final DocumentRole role = classifier.classify(file);
                if (role != DocumentRole.SOURCE_ORIGINAL && role != DocumentRole.EXTRACTED_RANGE) {
                    continue;
                }
                counters.processed();
                final String backupName = classifier.backupName(file.getFileName().toString());
                try {
                    final Path backup = context.copier().copy(file, folder.resolve(backupName));
                    if (!snapshot.containsFile(backup.getFileName().toString())) {
                        counters.changed();
                        logger.info("{}: backup {} -> {}", folder.getFileName(), file.getFileName(), backup.getFileName());
                    }
                } catch (final IOException e) {
                    context.journal().ioError(NAME, "Backing up " + file + " failed", e);
                    counters.failed();
                }
            }
        }
        return counters.result();
    }
}
