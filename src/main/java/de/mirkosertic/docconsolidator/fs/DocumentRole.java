package de.mirkosertic.docconsolidator.fs;

/**
 * Role of a file inside an entity folder, inferred from its name.
 */
public enum DocumentRole {

    /** The source document fetched from the source store. */
    SOURCE_ORIGINAL,

    /** A single page taken from the master document, named {@code <page>.pdf}. */
    EXTRACTED_RANGE,

    /** A duplicate carrying the backup marker. */
    BACKUP_COPY,

    /** The deduplicated merge of all other PDFs. */
    MERGED_OUTPUT,

    /** Anything that is not a PDF: tables, cache sidecars, temporary files. */
    OTHER
}
