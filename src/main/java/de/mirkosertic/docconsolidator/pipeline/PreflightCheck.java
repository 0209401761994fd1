package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.config.ApplicationConfig;
import de.mirkosertic.docconsolidator.source.DirectorySourceStore;
import de.mirkosertic.docconsolidator.source.PageIndexFile;
import de.mirkosertic.docconsolidator.table.EntityTable;
import de.mirkosertic.docconsolidator.table.TableFormatException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Validates the global inputs and opens them. Nothing under the destination root is
 * touched before all inputs passed.
 * <p>
 * A missing entity table is created as an empty template so the operator only has
 * to fill it in; the run still stops.
 */
public final class PreflightCheck {

    private static final Logger logger = LoggerFactory.getLogger(PreflightCheck.class);

    private PreflightCheck() {
    }

    public static RunContext prepare(final ApplicationConfig config, final RunJournal journal, final Clock clock)
            throws SetupException {
        final Path destinationRoot = requireDirectory(config.getDestinationRoot(), "destination root");
        final Path sourceStore = requireDirectory(config.getSourceStore(), "source store");
        final Path referenceIndex = requireFile(config.getReferenceIndex(), "reference index");
        final Path masterDocument = requireFile(config.getMasterDocument(), "master document");
        final Path entityTablePath = requireConfigured(config.getEntityTable(), "entity table");

        if (!Files.exists(entityTablePath)) {
            try {
                EntityTable.createTemplate(entityTablePath);
            } catch (final IOException e) {
                throw new SetupException("Entity table " + entityTablePath + " does not exist and no template could be created", e);
            }
            throw new SetupException("Entity table " + entityTablePath
                    + " did not exist. An empty template was created, fill it in and run again.");
        }

        final EntityTable entityTable;
        try {
            entityTable = EntityTable.load(entityTablePath);
        } catch (final IOException e) {
            throw new SetupException("Cannot read entity table " + entityTablePath, e);
        }
        for (final TableFormatException problem : entityTable.formatProblems()) {
            journal.formatError("PREFLIGHT", entityTablePath, problem);
        }

        final PageIndexFile index;
        try {
            index = PageIndexFile.load(referenceIndex);
        } catch (final IOException e) {
            throw new SetupException("Cannot read reference index " + referenceIndex, e);
        }

        final PDDocument master;
        try {
            master = Loader.loadPDF(masterDocument.toFile());
        } catch (final IOException e) {
            throw new SetupException("Cannot open master document " + masterDocument, e);
        }
        logger.info("Master document {} has {} pages", masterDocument, master.getNumberOfPages());

        return RunContext.create(config, destinationRoot, entityTable, new DirectorySourceStore(sourceStore),
                index, master, journal, clock);
    }

    private static Path requireConfigured(final @Nullable Path path, final String what) throws SetupException {
        if (path == null) {
            throw new SetupException("No " + what + " configured");
        }
        return path;
    }

    private static Path requireDirectory(final @Nullable Path path, final String what) throws SetupException {
        final Path configured = requireConfigured(path, what);
        if (!Files.isDirectory(configured)) {
            throw new SetupException("The " + what + " " + configured + " is not a directory");
        }
        return configured;
    }

    private static Path requireFile(final @Nullable Path path, final String what) throws SetupException {
        final Path configured = requireConfigured(path, what);
        if (!Files.isRegularFile(configured) || !Files.isReadable(configured)) {
            throw new SetupException("The " + what + " " + configured + " is missing or unreadable");
        }
        return configured;
    }
}
