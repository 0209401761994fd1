package de.mirkosertic.docconsolidator.pipeline;

/**
 * A required global input is missing or unreadable. The run stops before anything is changed.
 */
public class SetupException extends Exception {

    public SetupException(final String message) {
        super(message);
    }

    public SetupException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
