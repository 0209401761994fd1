package de.mirkosertic.docconsolidator.source;

import java.util.List;

/**
 * Maps a document code to the master document pages that belong to it.
 */
public interface ReferenceIndex {

    /**
     * @return sorted, distinct page numbers, empty if the code is unknown
     */
    List<Integer> pagesFor(String code);
}
