package de.mirkosertic.docconsolidator.fs;

/**
 * How {@link SafeCopier} decides that an existing destination file already holds
 * the content being copied.
 */
public enum DuplicateCheck {

    /**
     * Equal byte size counts as the same file. Fast, but two distinct files of
     * equal length are treated as identical.
     */
    SIZE,

    /** Equal SHA-256 digest counts as the same file. */
    CONTENT
}
