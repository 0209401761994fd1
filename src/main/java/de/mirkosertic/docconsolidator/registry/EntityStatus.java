package de.mirkosertic.docconsolidator.registry;

import java.util.Locale;

/**
 * Status of an entity or a candidate table row as written into the {@code ISO Status} column.
 */
public enum EntityStatus {
    UNKNOWN(""),
    OK("OK"),
    MISSING("MISSING");

    private final String cellValue;

    EntityStatus(final String cellValue) {
        this.cellValue = cellValue;
    }

    public String cellValue() {
        return cellValue;
    }

    /**
     * Parse a cell value. Blank cells are {@link #UNKNOWN}.
     *
     * @throws IllegalArgumentException for any other unrecognized value
     */
    public static EntityStatus fromCell(final String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "OK" -> OK;
            case "MISSING" -> MISSING;
            default -> throw new IllegalArgumentException("Unknown status: " + value);
        };
    }
}
