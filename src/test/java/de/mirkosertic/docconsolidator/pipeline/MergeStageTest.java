package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.TestDocuments;
import de.mirkosertic.docconsolidator.hash.PageDeduplicator;
import de.mirkosertic.docconsolidator.hash.PageFingerprinter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("MergeStage")
class MergeStageTest {

    @TempDir
    Path tempDir;

    private PipelineFixture fixture;
    private PageDeduplicator deduplicator;
    private MergeStage stage;
    private Path folder;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new PipelineFixture(tempDir).withEntities(new String[]{"AB-12-34", "L1", "S1"});
        deduplicator = spy(new PageDeduplicator(new PageFingerprinter()));
        stage = new MergeStage(deduplicator);
        folder = Files.createDirectories(fixture.destination.resolve("L1_S1"));
        TestDocuments.createPdf(folder.resolve("2.pdf"), "Master page 2");
        TestDocuments.createPdf(folder.resolve("Pump(AB-12-34).pdf"), "Pump sheet 1");
        TestDocuments.createPdf(folder.resolve("Pump(AB-12-34)_FRI.pdf"), "Pump sheet 1");
    }

    private StageResult runStage() throws IOException {
        try (final RunContext context = fixture.context(new RunJournal())) {
            return stage.run(context);
        }
    }

    @Test
    @DisplayName("merges once and skips the unchanged folder afterwards")
    void skipsUnchangedFolder() throws Exception {
        final StageResult first = runStage();
        final StageResult second = runStage();

        verify(deduplicator, times(1)).merge(anyList(), any(Path.class), any());
        assertThat(first.changed()).isEqualTo(1);
        assertThat(second.changed()).isZero();
        assertThat(second.processed()).isEqualTo(1);
        assertThat(TestDocuments.pageTexts(folder.resolve("Combined.pdf")))
                .containsExactly("Master page 2", "Pump sheet 1");
        assertThat(folder.resolve(".merge-cache.yaml")).exists();
    }

    @Test
    @DisplayName("re-merges when a candidate changes by a single byte")
    void remergesChangedCandidate() throws Exception {
        runStage();
        Files.write(folder.resolve("2.pdf"), new byte[]{'\n'}, StandardOpenOption.APPEND);

        final StageResult second = runStage();

        verify(deduplicator, times(2)).merge(anyList(), any(Path.class), any());
        assertThat(second.changed()).isEqualTo(1);
    }

    @Test
    @DisplayName("re-merges when the merged output was removed")
    void remergesMissingOutput() throws Exception {
        runStage();
        Files.delete(folder.resolve("Combined.pdf"));

        runStage();

        verify(deduplicator, times(2)).merge(anyList(), any(Path.class), any());
        assertThat(folder.resolve("Combined.pdf")).exists();
    }

    @Test
    @DisplayName("does not cache a merge in which a candidate could not be read")
    void noCacheAfterFailedCandidate() throws Exception {
        Files.writeString(folder.resolve("Broken(XY-1-1).pdf"), "not a pdf");

        final StageResult first = runStage();
        runStage();

        assertThat(first.failed()).isEqualTo(1);
        assertThat(folder.resolve("Combined.pdf")).exists();
        assertThat(folder.resolve(".merge-cache.yaml")).doesNotExist();
        verify(deduplicator, times(2)).merge(anyList(), any(Path.class), any());
    }

    @Test
    @DisplayName("drops the cache and reports the merged output once all candidates are gone")
    void reportsStaleOutput() throws Exception {
        runStage();
        Files.delete(folder.resolve("2.pdf"));
        Files.delete(folder.resolve("Pump(AB-12-34).pdf"));
        Files.delete(folder.resolve("Pump(AB-12-34)_FRI.pdf"));
        final RunJournal journal = new RunJournal();

        final StageResult result;
        try (final RunContext context = fixture.context(journal)) {
            result = stage.run(context);
        }

        assertThat(result.changed()).isEqualTo(1);
        assertThat(folder.resolve(".merge-cache.yaml")).doesNotExist();
        assertThat(folder.resolve("Combined.pdf")).exists();
        assertThat(journal.issues()).singleElement().asString().contains("Combined.pdf");
        verify(deduplicator, times(1)).merge(anyList(), any(Path.class), any());
    }

    @Test
    @DisplayName("ignores folders without candidates")
    void ignoresEmptyFolders() throws Exception {
        Files.createDirectories(fixture.destination.resolve("L9_S9"));
        Files.delete(folder.resolve("2.pdf"));
        Files.delete(folder.resolve("Pump(AB-12-34).pdf"));
        Files.delete(folder.resolve("Pump(AB-12-34)_FRI.pdf"));

        final StageResult result = runStage();

        assertThat(result.processed()).isZero();
        verify(deduplicator, never()).merge(anyList(), any(Path.class), any());
    }
}
