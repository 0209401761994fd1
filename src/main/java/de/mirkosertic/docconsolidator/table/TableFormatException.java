package de.mirkosertic.docconsolidator.table;

/**
 * A spreadsheet does not match its expected schema.
 */
public class TableFormatException extends Exception {

    public enum Kind {
        /** A required header is absent. */
        MISSING_COLUMN,
        /** A cell holds a value that cannot be interpreted. */
        BAD_VALUE
    }

    private final Kind kind;
    private final String column;
    private final int rowNumber;

    public TableFormatException(final Kind kind, final String column, final int rowNumber, final String message) {
        super(message);
        this.kind = kind;
        this.column = column;
        this.rowNumber = rowNumber;
    }

    public static TableFormatException missingColumn(final String column) {
        return new TableFormatException(Kind.MISSING_COLUMN, column, 0, "Missing column '" + column + "'");
    }

    public static TableFormatException badValue(final String column, final int rowNumber, final String value) {
        return new TableFormatException(Kind.BAD_VALUE, column, rowNumber,
                "Bad value '" + value + "' in column '" + column + "', row " + (rowNumber + 1));
    }

    public Kind getKind() {
        return kind;
    }

    public String getColumn() {
        return column;
    }

    /** Zero based sheet row, 0 for header problems. */
    public int getRowNumber() {
        return rowNumber;
    }
}
