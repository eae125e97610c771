package com.charlib.tool.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A {@code timing} group of a pin. Empty strings stand for absent attributes.
 */
@Value
@Builder(toBuilder = true)
public class TimingArc {

    @NonNull
    @Builder.Default
    String when = "";

    @NonNull
    @Builder.Default
    String relatedPin = "";

    @NonNull
    @Builder.Default
    String timingType = "";

    /**
     * Descriptive only; not part of {@link #key()}.
     */
    @NonNull
    @Builder.Default
    String timingSense = "";

    @Singular
    Map<TimingLutSlot, Lut> luts;

    public TimingArcKey key() {
        return new TimingArcKey(when, relatedPin, timingType);
    }

    /**
     * The table held in {@code slot}, or {@link Lut#EMPTY}.
     */
    public Lut lut(TimingLutSlot slot) {
        return luts.getOrDefault(slot, Lut.EMPTY);
    }
}
