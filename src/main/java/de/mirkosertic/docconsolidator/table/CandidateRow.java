package de.mirkosertic.docconsolidator.table;

import de.mirkosertic.docconsolidator.registry.EntityStatus;

/**
 * One row of a folder's candidate table.
 *
 * @param rowNumber zero based sheet row, or -1 for a row not yet saved
 */
public record CandidateRow(int rowNumber, String code, String pages, EntityStatus status) {

    public CandidateRow withStatus(final EntityStatus newStatus) {
        return new CandidateRow(rowNumber, code, pages, newStatus);
    }

    public CandidateRow withRowNumber(final int newRowNumber) {
        return new CandidateRow(newRowNumber, code, pages, status);
    }
}
