package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.DocConsolidatorApplication;
import de.mirkosertic.docconsolidator.TestDocuments;
import de.mirkosertic.docconsolidator.registry.Entity;
import de.mirkosertic.docconsolidator.registry.EntityStatus;
import de.mirkosertic.docconsolidator.table.CandidateRow;
import de.mirkosertic.docconsolidator.table.CandidateTable;
import de.mirkosertic.docconsolidator.table.EntityTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PipelineOrchestrator")
class PipelineOrchestratorTest {

    @TempDir
    Path tempDir;

    private PipelineFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new PipelineFixture(tempDir).withEntities(
                new String[]{"AB-12-34", "L1", "S1"},
                new String[]{"ZZ-99", "L2", "S2"});
    }

    private RunSummary runOnce() throws SetupException {
        return new DocConsolidatorApplication(fixture.config(), PipelineFixture.CLOCK).run();
    }

    @Test
    @DisplayName("runs all seven stages in order")
    void standardStages() {
        assertThat(PipelineOrchestrator.standard().stages())
                .extracting(PipelineStage::name)
                .containsExactly(IngestionStage.NAME, CandidateTableStage.NAME, RangeExtractionStage.NAME,
                        BackupStage.NAME, RedundancyCleanupStage.NAME, MergeStage.NAME, VerificationStage.NAME);
    }

    @Test
    @DisplayName("consolidates a folder end to end")
    void endToEnd() throws Exception {
        final RunSummary summary = runOnce();

        final Path folder = fixture.destination.resolve("L1_S1");
        assertThat(folder.resolve("Pump(AB-12-34).pdf")).exists();
        assertThat(folder.resolve("2.pdf")).exists();
        assertThat(folder.resolve("3.pdf")).exists();
        assertThat(folder.resolve("1.pdf")).doesNotExist();
        assertThat(folder.resolve("Pump(AB-12-34)_FRI.pdf")).exists();
        assertThat(folder.resolve("2_FRI.pdf")).exists();
        assertThat(folder.resolve("3_FRI.pdf")).exists();
        assertThat(folder.resolve(".merge-cache.yaml")).exists();
        assertThat(TestDocuments.pageTexts(folder.resolve("Combined.pdf")))
                .containsExactly("Master page 2", "Master page 3", "Pump sheet 1", "Pump sheet 2");

        final List<CandidateRow> rows = CandidateTable.load(folder.resolve("output.xlsx")).rows();
        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.code()).isEqualTo("AB-12");
            assertThat(row.pages()).isEqualTo("2,3");
            assertThat(row.status()).isEqualTo(EntityStatus.OK);
        });

        final List<Entity> entities = EntityTable.load(fixture.entityTable).entities();
        assertThat(entities).extracting(Entity::status).containsExactly(EntityStatus.OK, EntityStatus.MISSING);
        assertThat(fixture.destination.resolve("L2_S2")).isDirectory();

        assertThat(summary.okEntities()).isEqualTo(1);
        assertThat(summary.missingEntities()).isEqualTo(1);
        assertThat(summary.stages()).hasSize(7);
        assertThat(summary.stages()).allSatisfy(stage -> assertThat(stage.failed()).isZero());
    }

    @Test
    @DisplayName("changes nothing on a second run with unchanged inputs")
    void idempotent() throws Exception {
        runOnce();
        final Map<String, FileTime> before = fixture.destinationState();

        final RunSummary second = runOnce();

        assertThat(fixture.destinationState()).isEqualTo(before);
        assertThat(second.stages()).allSatisfy(stage -> assertThat(stage.changed())
                .as("changes in %s", stage.stage())
                .isZero());
    }

    @Test
    @DisplayName("follows a key change by renaming the folder")
    void followsRename() throws Exception {
        runOnce();
        fixture.withEntities(
                new String[]{"AB-12-34", "L1", "S1-new", "L1_S1"},
                new String[]{"ZZ-99", "L2", "S2"});

        runOnce();

        assertThat(fixture.destination.resolve("L1_S1")).doesNotExist();
        assertThat(fixture.destination.resolve("L1_S1-new/Combined.pdf")).exists();
        assertThat(EntityTable.load(fixture.entityTable).entities().get(0).historyFolderName()).isEqualTo("L1_S1-new");
    }

    @Test
    @DisplayName("removes empty folders no entity names")
    void removesEmptyUntrackedFolders() throws Exception {
        Files.createDirectories(fixture.destination.resolve("stray"));

        runOnce();

        assertThat(fixture.destination.resolve("stray")).doesNotExist();
    }
}
