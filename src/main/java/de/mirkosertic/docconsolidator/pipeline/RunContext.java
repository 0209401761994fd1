package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.cache.MergeCache;
import de.mirkosertic.docconsolidator.config.ApplicationConfig;
import de.mirkosertic.docconsolidator.fs.DocumentClassifier;
import de.mirkosertic.docconsolidator.fs.SafeCopier;
import de.mirkosertic.docconsolidator.source.ReferenceIndex;
import de.mirkosertic.docconsolidator.source.SourceStore;
import de.mirkosertic.docconsolidator.table.EntityTable;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Everything a stage needs for one run. Passed to every {@link PipelineStage}.
 * <p>
 * Closing the context closes the master document.
 */
public record RunContext(
        ApplicationConfig config,
        Path destinationRoot,
        EntityTable entityTable,
        SourceStore sourceStore,
        ReferenceIndex referenceIndex,
        @Nullable PDDocument masterDocument,
        MergeCache mergeCache,
        SafeCopier copier,
        DocumentClassifier classifier,
        RunJournal journal,
        Clock clock
) implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RunContext.class);

    /**
     * Build a context, deriving the file system helpers from the configuration.
     */
    public static RunContext create(final ApplicationConfig config,
                                    final Path destinationRoot,
                                    final EntityTable entityTable,
                                    final SourceStore sourceStore,
                                    final ReferenceIndex referenceIndex,
                                    final @Nullable PDDocument masterDocument,
                                    final RunJournal journal,
                                    final Clock clock) {
        return new RunContext(config, destinationRoot, entityTable, sourceStore, referenceIndex, masterDocument,
                new MergeCache(config.getCacheSidecarName()),
                new SafeCopier(config.getDuplicateCheck()),
                DocumentClassifier.from(config),
                journal, clock);
    }

    public Path candidateTable(final Path folder) {
        return folder.resolve(config.getCandidateTableName());
    }

    public Path mergedOutput(final Path folder) {
        return folder.resolve(config.getMergedOutputName());
    }

    @Override
    public void close() {
        if (masterDocument != null) {
            try {
                masterDocument.close();
            } catch (final IOException e) {
                logger.warn("Failed to close master document", e);
            }
        }
    }
}
