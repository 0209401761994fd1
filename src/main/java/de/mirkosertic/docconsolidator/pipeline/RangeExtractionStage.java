package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.fs.DocumentClassifier;
import de.mirkosertic.docconsolidator.fs.FolderSnapshot;
import de.mirkosertic.docconsolidator.table.CandidateRow;
import de.mirkosertic.docconsolidator.table.CandidateTable;
import de.mirkosertic.docconsolidator.table.CandidateTableSchema;
import de.mirkosertic.docconsolidator.table.TableFormatException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Stage 3: copy every page listed in a folder's candidate table out of the master
 * document into {@code <page>.pdf}. Pages already extracted are left alone.
 */
public class RangeExtractionStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(RangeExtractionStage.class);

    static final String NAME = "P3 RANGE EXTRACTION";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult run(final RunContext context) throws IOException {
        final StageCounters counters = new StageCounters(NAME, context.clock());
        final PDDocument master = context.masterDocument();
        if (master == null) {
            throw new IOException("Master document is not open");
        }
        final int totalPages = master.getNumberOfPages();

        for (final Path folder : FolderSnapshot.entityFolders(context.destinationRoot())) {
            final Path tablePath = context.candidateTable(folder);
            if (!CandidateTable.exists(tablePath)) {
                continue;
            }
            counters.processed();
            try {
                final CandidateTable table = CandidateTable.load(tablePath);
                final FolderSnapshot snapshot = FolderSnapshot.capture(folder);
                for (final CandidateRow row : table.rows()) {
                    final List<Integer> pages = CandidateTableSchema.parsePages(row.pages(), row.rowNumber(),
                            problem -> context.journal().formatError(NAME, tablePath, problem));
                    for (final int page : pages) {
                        if (page > totalPages) {
                            context.journal().formatError(NAME, tablePath, TableFormatException.badValue(
                                    CandidateTableSchema.PAGES, row.rowNumber(), page + " (master has " + totalPages + " pages)"));
                            continue;
                        }
                        final String name = DocumentClassifier.extractedRangeName(page);
                        final Path target = folder.resolve(name);
                        if (snapshot.containsFile(name) || Files.exists(target)) {
                            continue;
                        }
                        try {
                            extractPage(master, page, target);
                            counters.changed();
                            logger.info("{}: extracted page {}", folder.getFileName(), page);
                        } catch (final IOException e) {
                            context.journal().ioError(NAME, "Extracting page " + page + " into " + folder + " failed", e);
                            counters.failed();
                        }
                    }
                }
            } catch (final IOException e) {
                context.journal().ioError(NAME, "Reading " + tablePath + " failed", e);
                counters.failed();
            }
        }
        return counters.result();
    }

    static void extractPage(final PDDocument master, final int page, final Path target) throws IOException {
        final Path temp = target.resolveSibling("." + target.getFileName() + ".tmp");
        try {
            try (final PDDocument single = new PDDocument()) {
                single.importPage(master.getPage(page - 1));
                single.save(temp.toFile());
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(temp, target);
            }
        } catch (final IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }
}
