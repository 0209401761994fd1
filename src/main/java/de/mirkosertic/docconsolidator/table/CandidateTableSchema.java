package de.mirkosertic.docconsolidator.table;

import de.mirkosertic.docconsolidator.registry.EntityStatus;
import org.apache.poi.ss.usermodel.Row;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Column layout of a candidate table and the page list format of its {@code PDF PAGE} column.
 */
public record CandidateTableSchema(int code, int pages, int status, List<TableFormatException> headerProblems) {

    public static final String CODE = "ISO LIST";
    public static final String PAGES = "PDF PAGE";
    public static final String STATUS = "ISO Status";

    public static final List<String> HEADERS = List.of(CODE, PAGES, STATUS);

    public CandidateTableSchema {
        headerProblems = List.copyOf(headerProblems);
    }

    public static CandidateTableSchema resolve(final Row header, final boolean newTable) {
        final Map<String, Integer> index = Workbooks.headerIndex(header);
        final List<TableFormatException> problems = new ArrayList<>();
        final int codeColumn;
        if (newTable) {
            codeColumn = Workbooks.ensureColumn(header, index, CODE);
        } else {
            final Integer existing = index.get(CODE.toLowerCase(Locale.ROOT));
            if (existing == null) {
                problems.add(TableFormatException.missingColumn(CODE));
            }
            codeColumn = existing == null ? -1 : existing;
        }
        return new CandidateTableSchema(codeColumn,
                Workbooks.ensureColumn(header, index, PAGES),
                Workbooks.ensureColumn(header, index, STATUS),
                problems);
    }

    public boolean usable() {
        return headerProblems.isEmpty();
    }

    public CandidateRow read(final Row row, final Consumer<TableFormatException> problems) {
        final String statusText = Workbooks.text(row, status);
        EntityStatus parsedStatus;
        try {
            parsedStatus = EntityStatus.fromCell(statusText);
        } catch (final IllegalArgumentException e) {
            problems.accept(TableFormatException.badValue(STATUS, row.getRowNum(), statusText));
            parsedStatus = EntityStatus.UNKNOWN;
        }
        return new CandidateRow(row.getRowNum(), Workbooks.text(row, code), Workbooks.text(row, pages), parsedStatus);
    }

    public void write(final Row row, final CandidateRow candidate) {
        Workbooks.write(row, code, candidate.code());
        Workbooks.write(row, pages, candidate.pages());
        Workbooks.write(row, status, candidate.status().cellValue());
    }

    /**
     * Parse a comma separated page list. Tokens that are not positive integers are
     * reported as {@link TableFormatException.Kind#BAD_VALUE} and skipped.
     *
     * @return the distinct pages in the order they appear
     */
    public static List<Integer> parsePages(final String cell, final int rowNumber,
                                           final Consumer<TableFormatException> problems) {
        final Set<Integer> result = new LinkedHashSet<>();
        if (cell == null || cell.isBlank()) {
            return List.of();
        }
        for (final String rawToken : cell.split(",")) {
            final String token = rawToken.trim();
            if (token.isEmpty()) {
                continue;
            }
            try {
                final int page = Integer.parseInt(token);
                if (page < 1) {
                    problems.accept(TableFormatException.badValue(PAGES, rowNumber, token));
                } else {
                    result.add(page);
                }
            } catch (final NumberFormatException e) {
                problems.accept(TableFormatException.badValue(PAGES, rowNumber, token));
            }
        }
        return List.copyOf(result);
    }

    /**
     * Sorted, distinct, comma separated.
     */
    public static String formatPages(final Collection<Integer> pages) {
        return new TreeSet<>(pages).stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
