package com.charlib.tool.tree;

/**
 * Liberty attribute shapes: {@code name : value;} and {@code name (v1, v2, ...);}.
 */
public enum AttributeType {
    SIMPLE,
    COMPLEX
}
