package de.mirkosertic.docconsolidator.table;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Shared POI plumbing for the .xlsx tables.
 */
final class Workbooks {

    private static final DataFormatter FORMATTER = new DataFormatter();

    private Workbooks() {
    }

    static Workbook open(final Path file) throws IOException {
        try (final InputStream in = Files.newInputStream(file)) {
            return new XSSFWorkbook(in);
        } catch (final RuntimeException e) {
            // POI reports corrupt packages with unchecked exceptions
            throw new IOException("Cannot read workbook " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Write to a hidden temporary sibling and move it over {@code file}.
     */
    static void save(final Workbook workbook, final Path file) throws IOException {
        final Path temp = file.resolveSibling("." + file.getFileName() + ".tmp");
        try {
            try (final OutputStream out = Files.newOutputStream(temp)) {
                workbook.write(out);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (final IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    static Sheet firstSheet(final Workbook workbook) {
        return workbook.getNumberOfSheets() == 0 ? workbook.createSheet() : workbook.getSheetAt(0);
    }

    static Row headerRow(final Sheet sheet) {
        final Row header = sheet.getRow(0);
        return header != null ? header : sheet.createRow(0);
    }

    /**
     * Header name (lower case, trimmed) to column index.
     */
    static Map<String, Integer> headerIndex(final Row header) {
        final Map<String, Integer> index = new HashMap<>();
        for (final Cell cell : header) {
            final String name = text(cell).toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                index.putIfAbsent(name, cell.getColumnIndex());
            }
        }
        return index;
    }

    /**
     * Column of {@code name}, appending the header if it is absent.
     */
    static int ensureColumn(final Row header, final Map<String, Integer> index, final String name) {
        final Integer existing = index.get(name.toLowerCase(Locale.ROOT));
        if (existing != null) {
            return existing;
        }
        final int column = Math.max(header.getLastCellNum(), 0);
        header.createCell(column).setCellValue(name);
        index.put(name.toLowerCase(Locale.ROOT), column);
        return column;
    }

    static String text(final Cell cell) {
        return cell == null ? "" : FORMATTER.formatCellValue(cell).trim();
    }

    static String text(final Row row, final int column) {
        if (row == null || column < 0) {
            return "";
        }
        return text(row.getCell(column));
    }

    static void write(final Row row, final int column, final String value) {
        final Cell cell = row.getCell(column);
        if (cell == null) {
            row.createCell(column).setCellValue(value);
        } else {
            cell.setCellValue(value);
        }
    }

    static boolean isBlank(final Row row) {
        if (row == null) {
            return true;
        }
        for (final Cell cell : row) {
            if (!text(cell).isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
