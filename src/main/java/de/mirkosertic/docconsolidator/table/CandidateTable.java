package de.mirkosertic.docconsolidator.table;

import de.mirkosertic.docconsolidator.registry.EntityStatus;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The candidate table of one entity folder: which document codes belong to the
 * folder and which master document pages go with each code.
 * <p>
 * Existing rows are never reordered or removed. New rows are appended and
 * statuses are updated in place.
 */
public final class CandidateTable {

    private final Path file;
    private final List<CandidateRow> rows;
    private final List<TableFormatException> formatProblems;
    private boolean dirty;

    private CandidateTable(final Path file, final List<CandidateRow> rows, final List<TableFormatException> formatProblems) {
        this.file = file;
        this.rows = rows;
        this.formatProblems = formatProblems;
    }

    public static boolean exists(final Path file) {
        return Files.isRegularFile(file);
    }

    /**
     * Load the table, or start an empty one if the file does not exist yet.
     */
    public static CandidateTable loadOrCreate(final Path file) throws IOException {
        if (!exists(file)) {
            return new CandidateTable(file, new ArrayList<>(), new ArrayList<>());
        }
        return load(file);
    }

    public static CandidateTable load(final Path file) throws IOException {
        final List<CandidateRow> rows = new ArrayList<>();
        final List<TableFormatException> problems = new ArrayList<>();

        try (final Workbook workbook = Workbooks.open(file)) {
            final Sheet sheet = Workbooks.firstSheet(workbook);
            final CandidateTableSchema schema = CandidateTableSchema.resolve(Workbooks.headerRow(sheet), false);
            problems.addAll(schema.headerProblems());
            if (schema.usable()) {
                for (int rowNumber = 1; rowNumber <= sheet.getLastRowNum(); rowNumber++) {
                    final Row row = sheet.getRow(rowNumber);
                    if (Workbooks.isBlank(row)) {
                        continue;
                    }
                    final CandidateRow candidate = schema.read(row, problems::add);
                    if (!candidate.code().isEmpty()) {
                        rows.add(candidate);
                    }
                }
            }
        }
        return new CandidateTable(file, rows, problems);
    }

    public Path file() {
        return file;
    }

    public List<CandidateRow> rows() {
        return List.copyOf(rows);
    }

    public Set<String> codes() {
        final Set<String> codes = new LinkedHashSet<>();
        for (final CandidateRow row : rows) {
            codes.add(row.code());
        }
        return codes;
    }

    public boolean contains(final String code) {
        return rows.stream().anyMatch(row -> row.code().equals(code));
    }

    public void append(final String code, final String pages) {
        rows.add(new CandidateRow(-1, code, pages, EntityStatus.UNKNOWN));
        dirty = true;
    }

    /**
     * @return whether the status changed
     */
    public boolean updateStatus(final int index, final EntityStatus status) {
        final CandidateRow row = rows.get(index);
        if (row.status() == status) {
            return false;
        }
        rows.set(index, row.withStatus(status));
        dirty = true;
        return true;
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * False if a required column is missing; the table then lists no rows and must not drive deletions.
     */
    public boolean usable() {
        return formatProblems.stream().noneMatch(p -> p.getKind() == TableFormatException.Kind.MISSING_COLUMN);
    }

    public List<TableFormatException> formatProblems() {
        return List.copyOf(formatProblems);
    }

    public void save() throws IOException {
        final boolean newTable = !exists(file);
        try (final Workbook workbook = newTable ? new XSSFWorkbook() : Workbooks.open(file)) {
            final Sheet sheet = Workbooks.firstSheet(workbook);
            final CandidateTableSchema schema = CandidateTableSchema.resolve(Workbooks.headerRow(sheet), true);
            int nextRow = sheet.getLastRowNum() + 1;
            for (int i = 0; i < rows.size(); i++) {
                CandidateRow candidate = rows.get(i);
                if (candidate.rowNumber() < 0) {
                    candidate = candidate.withRowNumber(nextRow++);
                    rows.set(i, candidate);
                }
                Row row = sheet.getRow(candidate.rowNumber());
                if (row == null) {
                    row = sheet.createRow(candidate.rowNumber());
                }
                schema.write(row, candidate);
            }
            Workbooks.save(workbook, file);
        }
        dirty = false;
    }
}
