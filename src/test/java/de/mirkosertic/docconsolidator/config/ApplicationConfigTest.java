package de.mirkosertic.docconsolidator.config;

import de.mirkosertic.docconsolidator.fs.DuplicateCheck;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig")
class ApplicationConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty("consolidator.test.root");
        System.clearProperty("consolidator.destination-root");
    }

    @Test
    @DisplayName("has built-in defaults")
    void defaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getCandidateTableName()).isEqualTo("output.xlsx");
        assertThat(config.getMergedOutputName()).isEqualTo("Combined.pdf");
        assertThat(config.getBackupMarker()).isEqualTo("_FRI");
        assertThat(config.getCacheSidecarName()).isEqualTo(".merge-cache.yaml");
        assertThat(config.getDuplicateCheck()).isEqualTo(DuplicateCheck.SIZE);
        assertThat(config.getDestinationRoot()).isNull();
    }

    @Test
    @DisplayName("applies YAML sections and ignores blank placeholders")
    void appliesYaml() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        config.applyYamlConfig(Map.of("consolidator", Map.of(
                "paths", Map.of(
                        "destination-root", "/data/dest",
                        "source-store", "${CONSOLIDATOR_UNSET_FOR_TEST:}"),
                "naming", Map.of("backup-marker", "_backup"),
                "copy", Map.of("duplicate-check", "content"))));

        assertThat(config.getDestinationRoot()).isEqualTo(Paths.get("/data/dest"));
        assertThat(config.getSourceStore()).isNull();
        assertThat(config.getBackupMarker()).isEqualTo("_backup");
        assertThat(config.getDuplicateCheck()).isEqualTo(DuplicateCheck.CONTENT);
    }

    @Test
    @DisplayName("resolves placeholders from system properties and defaults")
    void resolvesVariables() {
        System.setProperty("consolidator.test.root", "/mnt/share");

        assertThat(ApplicationConfig.resolveVariables("${consolidator.test.root:/x}/docs")).isEqualTo("/mnt/share/docs");
        assertThat(ApplicationConfig.resolveVariables("${CONSOLIDATOR_UNSET_FOR_TEST:fallback}")).isEqualTo("fallback");
        assertThat(ApplicationConfig.resolveVariables("plain")).isEqualTo("plain");
    }

    @Test
    @DisplayName("lets an explicit file and system properties override defaults")
    void layeredLoad() throws IOException {
        final Path file = Files.writeString(tempDir.resolve("run.yaml"), """
                consolidator:
                  paths:
                    entity-table: /from/file/entities.xlsx
                    destination-root: /from/file/dest
                  naming:
                    merged-output: Merged.pdf
                """);
        System.setProperty("consolidator.destination-root", "/from/property");

        final ApplicationConfig config = ApplicationConfig.load(file);

        assertThat(config.getEntityTable()).isEqualTo(Paths.get("/from/file/entities.xlsx"));
        assertThat(config.getMergedOutputName()).isEqualTo("Merged.pdf");
        if (System.getenv("CONSOLIDATOR_DESTINATION_ROOT") == null) {
            assertThat(config.getDestinationRoot()).isEqualTo(Paths.get("/from/property"));
        }
    }
}
