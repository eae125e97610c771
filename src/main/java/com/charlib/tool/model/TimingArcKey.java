package com.charlib.tool.model;

/**
 * Identity of a timing arc within a pin. {@code timing_sense} is not part of it.
 */
public record TimingArcKey(String when, String relatedPin, String timingType) {
}
