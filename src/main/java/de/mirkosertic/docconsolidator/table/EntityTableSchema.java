package de.mirkosertic.docconsolidator.table;

import de.mirkosertic.docconsolidator.registry.Entity;
import de.mirkosertic.docconsolidator.registry.EntityStatus;
import org.apache.poi.ss.usermodel.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Column layout of the entity table, resolved once from its header row.
 * <p>
 * The identity columns must be present. The derived columns are appended to the
 * header when they are missing.
 */
public record EntityTableSchema(
        int sourceReference,
        int loopKey,
        int systemKey,
        int folderName,
        int historyFolderName,
        int status,
        List<TableFormatException> headerProblems
) {

    public static final String SOURCE_REFERENCE = "Iso no";
    public static final String LOOP_KEY = "loop no";
    public static final String SYSTEM_KEY = "system no";
    public static final String FOLDER_NAME = "folder name";
    public static final String HISTORY_FOLDER_NAME = "history folder name";
    public static final String STATUS = "ISO Status";

    public static final List<String> HEADERS =
            List.of(SOURCE_REFERENCE, LOOP_KEY, SYSTEM_KEY, FOLDER_NAME, HISTORY_FOLDER_NAME, STATUS);

    public EntityTableSchema {
        headerProblems = List.copyOf(headerProblems);
    }

    public static EntityTableSchema resolve(final Row header) {
        final Map<String, Integer> index = Workbooks.headerIndex(header);
        final List<TableFormatException> problems = new ArrayList<>();

        final int sourceReference = required(index, SOURCE_REFERENCE, problems);
        final int loopKey = required(index, LOOP_KEY, problems);
        final int systemKey = required(index, SYSTEM_KEY, problems);

        return new EntityTableSchema(sourceReference, loopKey, systemKey,
                Workbooks.ensureColumn(header, index, FOLDER_NAME),
                Workbooks.ensureColumn(header, index, HISTORY_FOLDER_NAME),
                Workbooks.ensureColumn(header, index, STATUS),
                problems);
    }

    private static int required(final Map<String, Integer> index, final String name, final List<TableFormatException> problems) {
        final Integer column = index.get(name.toLowerCase(Locale.ROOT));
        if (column == null) {
            problems.add(TableFormatException.missingColumn(name));
            return -1;
        }
        return column;
    }

    public boolean usable() {
        return headerProblems.isEmpty();
    }

    /**
     * Read one data row. An unreadable status is reported and treated as unknown.
     */
    public Entity read(final Row row, final Consumer<TableFormatException> problems) {
        final String statusText = Workbooks.text(row, status);
        EntityStatus parsedStatus;
        try {
            parsedStatus = EntityStatus.fromCell(statusText);
        } catch (final IllegalArgumentException e) {
            problems.accept(TableFormatException.badValue(STATUS, row.getRowNum(), statusText));
            parsedStatus = EntityStatus.UNKNOWN;
        }
        return new Entity(row.getRowNum(),
                Workbooks.text(row, sourceReference),
                Workbooks.text(row, loopKey),
                Workbooks.text(row, systemKey),
                Workbooks.text(row, historyFolderName),
                parsedStatus);
    }

    public void write(final Row row, final Entity entity) {
        Workbooks.write(row, folderName, entity.desiredFolderName());
        Workbooks.write(row, historyFolderName, entity.historyFolderName());
        Workbooks.write(row, status, entity.status().cellValue());
    }
}
