package com.charlib.tool.model;

/**
 * Identity of a leakage_power entry within a cell.
 */
public record LeakageKey(String when, String relatedPgPin) {
}
