package de.mirkosertic.docconsolidator.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Where source documents are fetched from.
 */
public interface SourceStore {

    /**
     * Find the source document for a reference.
     *
     * @param reference the entity's source-document reference
     * @return the document, or empty if the store holds none for the reference
     * @throws IOException if the store cannot be searched
     */
    Optional<Path> find(String reference) throws IOException;
}
