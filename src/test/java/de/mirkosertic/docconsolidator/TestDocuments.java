package de.mirkosertic.docconsolidator;

import de.mirkosertic.docconsolidator.table.EntityTableSchema;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility class to generate the PDFs and spreadsheets the tests run against.
 */
public final class TestDocuments {

    private TestDocuments() {
    }

    /**
     * One page per text, each drawn with Helvetica 12pt at (50, 700).
     */
    public static Path createPdf(final Path path, final String... pageTexts) throws IOException {
        return createPdfAt(path, 50, 700, pageTexts);
    }

    public static Path createPdfAt(final Path path, final float x, final float y, final String... pageTexts) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        try (final PDDocument document = new PDDocument()) {
            for (final String text : pageTexts) {
                final PDPage page = new PDPage();
                document.addPage(page);
                try (final PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    contentStream.newLineAtOffset(x, y);
                    contentStream.showText(text);
                    contentStream.endText();
                }
            }
            document.save(path.toFile());
        }
        return path;
    }

    /**
     * Extracted text of every page, trimmed.
     */
    public static List<String> pageTexts(final Path pdf) throws IOException {
        final List<String> texts = new ArrayList<>();
        try (final PDDocument document = Loader.loadPDF(pdf.toFile())) {
            final PDFTextStripper stripper = new PDFTextStripper();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                texts.add(stripper.getText(document).trim());
            }
        }
        return texts;
    }

    /**
     * Entity table with the standard headers. Each row lists Iso no, loop no, system no
     * and optionally the history folder name.
     */
    public static Path createEntityTable(final Path path, final String[]... rows) throws IOException {
        return createSheet(path, EntityTableSchema.HEADERS, rows, new int[]{0, 1, 2, 4});
    }

    /**
     * Spreadsheet with arbitrary headers; row values are written left to right.
     */
    public static Path createSheet(final Path path, final List<String> headers, final String[]... rows) throws IOException {
        final int[] columns = new int[headers.size()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = i;
        }
        return createSheet(path, headers, rows, columns);
    }

    private static Path createSheet(final Path path, final List<String> headers, final String[][] rows,
                                    final int[] columns) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        try (final XSSFWorkbook workbook = new XSSFWorkbook()) {
            final Sheet sheet = workbook.createSheet("Sheet1");
            final Row header = sheet.createRow(0);
            for (int i = 0; i < headers.size(); i++) {
                header.createCell(i).setCellValue(headers.get(i));
            }
            for (int r = 0; r < rows.length; r++) {
                final Row row = sheet.createRow(r + 1);
                for (int c = 0; c < rows[r].length && c < columns.length; c++) {
                    row.createCell(columns[c]).setCellValue(rows[r][c]);
                }
            }
            try (final OutputStream out = Files.newOutputStream(path)) {
                workbook.write(out);
            }
        }
        return path;
    }

    public static Path createIndexFile(final Path path, final String... lines) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        return Files.write(path, List.of(lines));
    }
}
