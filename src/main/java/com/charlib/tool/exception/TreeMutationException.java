package com.charlib.tool.exception;

/**
 * A single create/delete/set operation on the attribute tree failed.
 * Callers abandon that attribute and carry on with the rest of the traversal.
 */
public class TreeMutationException extends LibertyToolException {

    private static final long serialVersionUID = 1L;

    public TreeMutationException(String message) {
        super(message);
    }
}
