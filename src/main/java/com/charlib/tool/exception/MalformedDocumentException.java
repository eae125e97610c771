package com.charlib.tool.exception;

/**
 * An interchange document does not match the expected schema.
 * The JSON path of the offending field is kept for reporting.
 */
public class MalformedDocumentException extends LibertyToolException {

    private static final long serialVersionUID = 1L;
    private final String path;

    public MalformedDocumentException(String path, String message) {
        super(path.isEmpty() ? message : path + ": " + message);
        this.path = path;
    }

    public MalformedDocumentException(String path, String message, Throwable cause) {
        super(path.isEmpty() ? message : path + ": " + message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
