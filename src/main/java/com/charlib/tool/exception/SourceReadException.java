package com.charlib.tool.exception;

import java.nio.file.Path;

/**
 * The tree engine could not open or read a Liberty source. Fatal to the current call.
 */
public class SourceReadException extends LibertyToolException {

    private static final long serialVersionUID = 1L;
    private final transient Path source;

    public SourceReadException(Path source, String message) {
        super("Failed to read Liberty source " + source + ": " + message);
        this.source = source;
    }

    public SourceReadException(Path source, String message, Throwable cause) {
        super("Failed to read Liberty source " + source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
