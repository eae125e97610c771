package com.charlib.tool.exception;

/**
 * Base type for every failure raised by the extraction, codec and patch layers.
 */
public class LibertyToolException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LibertyToolException(String message) {
        super(message);
    }

    public LibertyToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
