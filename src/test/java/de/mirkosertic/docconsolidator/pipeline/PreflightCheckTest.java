package de.mirkosertic.docconsolidator.pipeline;

import de.mirkosertic.docconsolidator.config.ApplicationConfig;
import de.mirkosertic.docconsolidator.table.EntityTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PreflightCheck")
class PreflightCheckTest {

    @TempDir
    Path tempDir;

    private PipelineFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new PipelineFixture(tempDir);
    }

    @Test
    @DisplayName("creates an entity table template and stops when the table is missing")
    void createsTemplate() throws Exception {
        final RunJournal journal = new RunJournal();

        assertThatThrownBy(() -> PreflightCheck.prepare(fixture.config(), journal, PipelineFixture.CLOCK))
                .isInstanceOf(SetupException.class)
                .hasMessageContaining("template");

        assertThat(fixture.entityTable).exists();
        final EntityTable template = EntityTable.load(fixture.entityTable);
        assertThat(template.entities()).isEmpty();
        assertThat(template.formatProblems()).isEmpty();
        try (final var listing = Files.list(fixture.destination)) {
            assertThat(listing).isEmpty();
        }
    }

    @Test
    @DisplayName("stops without creating anything when the destination root is missing")
    void missingDestination() throws Exception {
        fixture.withEntities(new String[]{"AB-12-34", "L1", "S1"});
        final ApplicationConfig config = fixture.config();
        final Path missing = tempDir.resolve("nowhere");
        config.setDestinationRoot(missing);

        assertThatThrownBy(() -> PreflightCheck.prepare(config, new RunJournal(), PipelineFixture.CLOCK))
                .isInstanceOf(SetupException.class)
                .hasMessageContaining("destination root");
        assertThat(missing).doesNotExist();
    }

    @Test
    @DisplayName("rejects a missing master document")
    void missingMaster() throws Exception {
        fixture.withEntities(new String[]{"AB-12-34", "L1", "S1"});
        Files.delete(fixture.masterDocument);

        assertThatThrownBy(() -> PreflightCheck.prepare(fixture.config(), new RunJournal(), PipelineFixture.CLOCK))
                .isInstanceOf(SetupException.class)
                .hasMessageContaining("master document");
    }

    @Test
    @DisplayName("rejects an unconfigured source store")
    void unconfiguredSourceStore() {
        final ApplicationConfig config = ApplicationConfig.defaults();
        config.setDestinationRoot(fixture.destination);

        assertThatThrownBy(() -> PreflightCheck.prepare(config, new RunJournal(), PipelineFixture.CLOCK))
                .isInstanceOf(SetupException.class)
                .hasMessageContaining("source store");
    }

    @Test
    @DisplayName("opens all inputs when they are valid")
    void opensInputs() throws Exception {
        fixture.withEntities(new String[]{"AB-12-34", "L1", "S1"});

        try (final RunContext context = PreflightCheck.prepare(fixture.config(), new RunJournal(), PipelineFixture.CLOCK)) {
            assertThat(context.masterDocument()).isNotNull();
            assertThat(context.masterDocument().getNumberOfPages()).isEqualTo(3);
            assertThat(context.entityTable().entities()).hasSize(1);
            assertThat(context.referenceIndex().pagesFor("AB-12")).containsExactly(2, 3);
            assertThat(context.sourceStore().find("AB-12-34")).isPresent();
        }
    }
}
