package de.mirkosertic.docconsolidator;

import de.mirkosertic.docconsolidator.config.ApplicationConfig;
import de.mirkosertic.docconsolidator.config.LoggingConfigurator;
import de.mirkosertic.docconsolidator.pipeline.PipelineOrchestrator;
import de.mirkosertic.docconsolidator.pipeline.PreflightCheck;
import de.mirkosertic.docconsolidator.pipeline.RunContext;
import de.mirkosertic.docconsolidator.pipeline.RunJournal;
import de.mirkosertic.docconsolidator.pipeline.RunSummary;
import de.mirkosertic.docconsolidator.pipeline.SetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

public class DocConsolidatorApplication {

    private static final Logger logger = LoggerFactory.getLogger(DocConsolidatorApplication.class);

    private final ApplicationConfig config;
    private final Clock clock;

    public DocConsolidatorApplication(final ApplicationConfig config, final Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Run all stages once.
     *
     * @throws SetupException if a global input is missing; nothing has been changed then
     */
    public RunSummary run() throws SetupException {
        final RunJournal journal = new RunJournal();
        try (final RunContext context = PreflightCheck.prepare(config, journal, clock)) {
            return PipelineOrchestrator.standard().run(context);
        }
    }

    public static void main(final String[] args) {
        final ApplicationConfig config;
        try {
            final Path explicitConfig = args.length > 0 ? Paths.get(args[0]) : null;
            config = ApplicationConfig.load(explicitConfig);
        } catch (final RuntimeException e) {
            System.err.println("Failed to load configuration: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
            return;
        }

        // Truncates and opens the action log and the error report
        LoggingConfigurator.configure(config.getLogDirectory());
        logger.info("Starting document consolidation, destination {}", config.getDestinationRoot());

        try {
            new DocConsolidatorApplication(config, Clock.systemDefaultZone()).run();
            logger.info("Document consolidation finished.");
        } catch (final SetupException e) {
            LoggerFactory.getLogger(RunJournal.ERROR_LOGGER).error("SETUP: {}", e.getMessage());
            logger.error("Run aborted before any change", e);
            System.exit(1);
        }
    }
}
