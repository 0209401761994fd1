package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.hash.PageDeduplicator;
import de.mirkosertic.docconsolidator.hash.PageFingerprinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Runs the stages strictly in sequence. A stage that fails as a whole is reported
 * and the remaining stages still run.
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final List<PipelineStage> stages;

    public PipelineOrchestrator(final List<PipelineStage> stages) {
        this.stages = List.copyOf(stages);
    }

    /**
     * The seven stages of a consolidation run in their fixed order.
     */
    public static PipelineOrchestrator standard() {
        return new PipelineOrchestrator(List.of(
                new IngestionStage(),
                new CandidateTableStage(),
                new RangeExtractionStage(),
                new BackupStage(),
                new RedundancyCleanupStage(),
                new MergeStage(new PageDeduplicator(new PageFingerprinter())),
                new VerificationStage()));
    }

    public List<PipelineStage> stages() {
        return stages;
    }

    public RunSummary run(final RunContext context) {
        final long runStart = context.clock().millis();

        for (final PipelineStage stage : stages) {
            logger.info("=== {} START ===", stage.name());
            final long stageStart = context.clock().millis();
            StageResult result;
            try {
                result = stage.run(context);
            } catch (final IOException | RuntimeException e) {
                context.journal().ioError(stage.name(), "Stage aborted", e);
                logger.error("Stage {} aborted", stage.name(), e);
                result = new StageResult(stage.name(), 0, 0, 1, context.clock().millis() - stageStart);
            }
            context.journal().stageFinished(result);
            logger.info("=== {} END ({}) ===", stage.name(), RunSummary.formatElapsed(result.elapsedMs()));
        }

        final RunSummary summary = RunSummary.of(context, context.clock().millis() - runStart);
        summary.log();
        return summary;
    }
}
