package de.mirkosertic.docconsolidator.hash;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FolderFingerprint")
class FolderFingerprintTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("is stable for unchanged candidates and sensitive to content, order and names")
    void sensitivity() throws IOException {
        final Path a = Files.writeString(tempDir.resolve("a.pdf"), "aaa");
        final Path b = Files.writeString(tempDir.resolve("b.pdf"), "bbb");

        final String base = FolderFingerprint.of(List.of(a, b));
        assertThat(FolderFingerprint.of(List.of(a, b))).isEqualTo(base);
        assertThat(FolderFingerprint.of(List.of(b, a))).isNotEqualTo(base);

        Files.writeString(b, "bbc");
        assertThat(FolderFingerprint.of(List.of(a, b))).isNotEqualTo(base);

        Files.writeString(b, "bbb");
        final Path renamed = Files.move(b, tempDir.resolve("c.pdf"));
        assertThat(FolderFingerprint.of(List.of(a, renamed))).isNotEqualTo(base);
    }
}
