package de.mirkosertic.docconsolidator.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Points the file appenders at the run's log directory.
 * <p>
 * The default logback.xml only logs to the console. Once the log directory of
 * a run is known, logback-run.xml is loaded with {@code docconsolidator.log.dir}
 * set, adding the action log and the error report. Both file appenders open
 * with {@code append=false}, so the logs are truncated at the start of every run.
 */
public final class LoggingConfigurator {

    public static final String LOG_DIR_PROPERTY = "docconsolidator.log.dir";
    private static final String RUN_CONFIG = "logback-run.xml";

    private LoggingConfigurator() {
    }

    /**
     * Reconfigure logging to write into the given directory.
     * Must be called before the first stage runs.
     *
     * @param logDirectory directory receiving orchestrator_log.txt and error_report.txt
     */
    public static void configure(final Path logDirectory) {
        ensureLogDirectoryExists(logDirectory);
        System.setProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());
        loadConfiguration(RUN_CONFIG);
    }

    private static void ensureLogDirectoryExists(final Path logDirectory) {
        try {
            if (!Files.exists(logDirectory)) {
                Files.createDirectories(logDirectory);
            }
        } catch (final Exception e) {
            System.err.println("Warning: Could not create log directory: " + logDirectory);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final Exception e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
