package com.charlib.tool.model;

/**
 * Identity of an internal power arc within a pin.
 */
public record PowerArcKey(String when, String relatedPin, String relatedPgPin) {
}
