package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.registry.Entity;
import de.mirkosertic.docconsolidator.registry.EntityStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final tally of a run, logged when the last stage finished.
 */
public record RunSummary(
        int okEntities,
        int missingEntities,
        int unknownEntities,
        List<String> issues,
        int errors,
        List<StageResult> stages,
        long elapsedMs
) {

    private static final Logger logger = LoggerFactory.getLogger(RunSummary.class);

    public RunSummary {
        issues = List.copyOf(issues);
        stages = List.copyOf(stages);
    }

    public static RunSummary of(final RunContext context, final long elapsedMs) {
        final Map<EntityStatus, Integer> counts = new EnumMap<>(EntityStatus.class);
        for (final Entity entity : context.entityTable().entities()) {
            counts.merge(entity.status(), 1, Integer::sum);
        }
        return new RunSummary(
                counts.getOrDefault(EntityStatus.OK, 0),
                counts.getOrDefault(EntityStatus.MISSING, 0),
                counts.getOrDefault(EntityStatus.UNKNOWN, 0),
                context.journal().issues(),
                context.journal().totalErrors(),
                context.journal().stageResults(),
                elapsedMs);
    }

    /**
     * Elapsed time as {@code HH:MM:SS}.
     */
    public static String formatElapsed(final long elapsedMs) {
        final long seconds = elapsedMs / 1000;
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    public void log() {
        logger.info("=== SUMMARY ===");
        logger.info("Entities: {} OK, {} MISSING, {} without status", okEntities, missingEntities, unknownEntities);
        for (final StageResult stage : stages) {
            logger.info("{}: {} processed, {} changed, {} failed ({})", stage.stage(), stage.processed(),
                    stage.changed(), stage.failed(), formatElapsed(stage.elapsedMs()));
        }
        if (!issues.isEmpty()) {
            logger.info("{} outstanding issues:", issues.size());
            issues.forEach(issue -> logger.info("  {}", issue));
        }
        logger.info("{} errors, see error_report.txt. Total time {}", errors, formatElapsed(elapsedMs));
    }
}
