package com.charlib.tool.tree;

/**
 * Lexical kind of a single attribute value.
 */
public enum ValueKind {
    /** Double-quoted text. */
    STRING,
    /** Unquoted numeric literal. */
    NUMBER,
    /** Unquoted word such as {@code input} or {@code true}. */
    WORD
}
