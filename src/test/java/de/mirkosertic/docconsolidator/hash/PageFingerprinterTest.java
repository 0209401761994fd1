package de.mirkosertic.docconsolidator.hash;

import de.mirkosertic.docconsolidator.TestDocuments;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PageFingerprinter")
class PageFingerprinterTest {

    @TempDir
    Path tempDir;

    private final PageFingerprinter fingerprinter = new PageFingerprinter();

    private String fingerprint(final Path pdf, final int page) throws IOException {
        try (final PDDocument document = Loader.loadPDF(pdf.toFile())) {
            return fingerprinter.fingerprint(document, page);
        }
    }

    @Test
    @DisplayName("is a lower-case SHA-256 hex string")
    void format() throws IOException {
        final Path pdf = TestDocuments.createPdf(tempDir.resolve("a.pdf"), "Page one");

        assertThat(fingerprint(pdf, 0)).matches("[0-9a-f]{64}");
    }

    @Test
    @DisplayName("is equal for the same page in different files")
    void samePageDifferentFiles() throws IOException {
        final Path first = TestDocuments.createPdf(tempDir.resolve("a.pdf"), "Shared page");
        final Path second = TestDocuments.createPdf(tempDir.resolve("b.pdf"), "Other page", "Shared page");

        assertThat(fingerprint(first, 0)).isEqualTo(fingerprint(second, 1));
    }

    @Test
    @DisplayName("survives a binary re-save")
    void resaveKeepsFingerprint() throws IOException {
        final Path original = TestDocuments.createPdf(tempDir.resolve("a.pdf"), "Stable text");
        final Path resaved = tempDir.resolve("resaved.pdf");
        try (final PDDocument document = Loader.loadPDF(original.toFile())) {
            document.getDocumentInformation().setTitle("changed metadata");
            document.save(resaved.toFile());
        }

        assertThat(fingerprint(resaved, 0)).isEqualTo(fingerprint(original, 0));
    }

    @Test
    @DisplayName("changes with the text")
    void textChangesFingerprint() throws IOException {
        final Path pdf = TestDocuments.createPdf(tempDir.resolve("a.pdf"), "Revision A", "Revision B");

        assertThat(fingerprint(pdf, 0)).isNotEqualTo(fingerprint(pdf, 1));
    }

    @Test
    @DisplayName("changes with the position of the text")
    void positionChangesFingerprint() throws IOException {
        final Path left = TestDocuments.createPdfAt(tempDir.resolve("left.pdf"), 50, 700, "Same words");
        final Path right = TestDocuments.createPdfAt(tempDir.resolve("right.pdf"), 200, 700, "Same words");

        assertThat(fingerprint(left, 0)).isNotEqualTo(fingerprint(right, 0));
    }

    @Test
    @DisplayName("rounds positions to a tenth of a point")
    void tenths() {
        assertThat(PageFingerprinter.tenths(12.34f)).isEqualTo(123L);
        assertThat(PageFingerprinter.tenths(12.36f)).isEqualTo(124L);
    }
}
