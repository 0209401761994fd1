package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.TestDocuments;
import de.mirkosertic.docconsolidator.table.CandidateTableSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RangeExtractionStage")
class RangeExtractionStageTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("extracts listed pages and reports pages outside the master document")
    void extractsListedPages() throws Exception {
        final PipelineFixture fixture = new PipelineFixture(tempDir).withEntities(new String[]{"AB-12-34", "L1", "S1"});
        final Path folder = Files.createDirectories(fixture.destination.resolve("L1_S1"));
        TestDocuments.createSheet(folder.resolve("output.xlsx"), CandidateTableSchema.HEADERS,
                new String[]{"AB-12", "3,1,7,x", ""});
        final RunJournal journal = new RunJournal();

        final StageResult result;
        try (final RunContext context = fixture.context(journal)) {
            result = new RangeExtractionStage().run(context);
        }

        assertThat(result.changed()).isEqualTo(2);
        assertThat(TestDocuments.pageTexts(folder.resolve("1.pdf"))).containsExactly("Master page 1");
        assertThat(TestDocuments.pageTexts(folder.resolve("3.pdf"))).containsExactly("Master page 3");
        assertThat(folder.resolve("7.pdf")).doesNotExist();
        assertThat(journal.errorCount(RunJournal.ErrorKind.FORMAT)).isEqualTo(2);
    }

    @Test
    @DisplayName("leaves pages that were already extracted untouched")
    void keepsExistingPages() throws Exception {
        final PipelineFixture fixture = new PipelineFixture(tempDir).withEntities(new String[]{"AB-12-34", "L1", "S1"});
        final Path folder = Files.createDirectories(fixture.destination.resolve("L1_S1"));
        TestDocuments.createSheet(folder.resolve("output.xlsx"), CandidateTableSchema.HEADERS,
                new String[]{"AB-12", "2", ""});
        TestDocuments.createPdf(folder.resolve("2.pdf"), "Edited by hand");

        final StageResult result;
        try (final RunContext context = fixture.context(new RunJournal())) {
            result = new RangeExtractionStage().run(context);
        }

        assertThat(result.changed()).isZero();
        assertThat(TestDocuments.pageTexts(folder.resolve("2.pdf"))).containsExactly("Edited by hand");
    }
}
