package com.charlib.tool.exception;

/**
 * A Liberty source is syntactically broken, or a present attribute holds a value
 * that cannot be read as a number.
 */
public class MalformedSourceException extends LibertyToolException {

    private static final long serialVersionUID = 1L;

    public MalformedSourceException(String message) {
        super(message);
    }

    public MalformedSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
