package de.mirkosertic.docconsolidator.registry;

import java.util.Objects;

/**
 * One row of the entity table: a record identified by its loop and system keys.
 * <p>
 * The desired folder name is derived from the keys on every access. The history
 * folder name is the last name confirmed on disk and only changes after the
 * folder was physically reconciled.
 */
public final class Entity {

    private final int rowNumber;
    private final String sourceReference;
    private final String loopKey;
    private final String systemKey;
    private String historyFolderName;
    private EntityStatus status;

    public Entity(final int rowNumber, final String sourceReference, final String loopKey, final String systemKey,
                  final String historyFolderName, final EntityStatus status) {
        this.rowNumber = rowNumber;
        this.sourceReference = nullToEmpty(sourceReference).trim();
        this.loopKey = nullToEmpty(loopKey);
        this.systemKey = nullToEmpty(systemKey);
        this.historyFolderName = nullToEmpty(historyFolderName).trim();
        this.status = Objects.requireNonNull(status);
        if (this.historyFolderName.isEmpty()) {
            this.historyFolderName = desiredFolderName();
        }
    }

    /**
     * {@code trim(loop) + "_" + trim(system)}, or an empty string if either key is blank.
     */
    public static String folderName(final String loopKey, final String systemKey) {
        final String loop = nullToEmpty(loopKey).trim();
        final String system = nullToEmpty(systemKey).trim();
        if (loop.isEmpty() || system.isEmpty()) {
            return "";
        }
        return loop + "_" + system;
    }

    public String desiredFolderName() {
        return folderName(loopKey, systemKey);
    }

    /** Zero based sheet row this entity was read from. */
    public int rowNumber() {
        return rowNumber;
    }

    public String sourceReference() {
        return sourceReference;
    }

    public boolean hasSourceReference() {
        return !sourceReference.isEmpty();
    }

    public String loopKey() {
        return loopKey;
    }

    public String systemKey() {
        return systemKey;
    }

    public String historyFolderName() {
        return historyFolderName;
    }

    public void confirmFolder(final String folderName) {
        this.historyFolderName = folderName;
    }

    public EntityStatus status() {
        return status;
    }

    public void status(final EntityStatus status) {
        this.status = Objects.requireNonNull(status);
    }

    private static String nullToEmpty(final String value) {
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return "Entity{row=" + rowNumber + ", loop='" + loopKey + "', system='" + systemKey
                + "', history='" + historyFolderName + "', status=" + status + "}";
    }
}
