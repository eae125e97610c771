package com.charlib.tool.tree;

import java.util.Objects;

/**
 * One value of a simple or complex attribute, kept as its source text.
 */
public record AttributeValue(ValueKind kind, String text) {

    public AttributeValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static AttributeValue string(String text) {
        return new AttributeValue(ValueKind.STRING, text);
    }

    public static AttributeValue number(String text) {
        return new AttributeValue(ValueKind.NUMBER, text);
    }

    public static AttributeValue word(String text) {
        return new AttributeValue(ValueKind.WORD, text);
    }

    public boolean isQuoted() {
        return kind == ValueKind.STRING;
    }
}
