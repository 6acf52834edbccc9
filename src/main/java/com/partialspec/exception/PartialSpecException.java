package com.partialspec.exception;

/**
 * A runtime exception for failures that abort a partial spec run.
 * <p>
 * Thrown when a required input is missing, when the output cannot be written, or
 * wrapped around lower-level errors so the command layer can report one clear message.
 */
public class PartialSpecException extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public PartialSpecException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause   The underlying cause. A {@code null} value is permitted.
     */
    public PartialSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
