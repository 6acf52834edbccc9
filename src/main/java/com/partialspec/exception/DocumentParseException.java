package com.partialspec.exception;

import java.nio.file.Path;

/**
 * Signals that an input artifact exists but is not a well-formed document.
 * This is always fatal: the run aborts before any output is written.
 */
public class DocumentParseException extends PartialSpecException {

    private final transient Path source;

    public DocumentParseException(Path source, String message) {
        super("Could not parse " + source + ": " + message);
        this.source = source;
    }

    public DocumentParseException(Path source, String message, Throwable cause) {
        super("Could not parse " + source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
