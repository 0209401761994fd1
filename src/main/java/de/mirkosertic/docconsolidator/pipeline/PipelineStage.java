package de.mirkosertic.docconsolidator.pipeline;

import java.io.IOException;

/**
 * One step of the consolidation run.
 * <p>
 * Implementations catch failures of single units (entities, folders, files), report
 * them to the {@link RunJournal} and continue. An exception escaping {@link #run}
 * means the stage as a whole could not proceed; the orchestrator reports it and
 * moves on to the next stage.
 */
public interface PipelineStage {

    String name();

    StageResult run(RunContext context) throws IOException;
}
