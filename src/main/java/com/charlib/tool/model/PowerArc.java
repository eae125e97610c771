package com.charlib.tool.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An {@code internal_power} group of a pin.
 */
@Value
@Builder(toBuilder = true)
public class PowerArc {

    @NonNull
    @Builder.Default
    String when = "";

    @NonNull
    @Builder.Default
    String relatedPin = "";

    @NonNull
    @Builder.Default
    String relatedPgPin = "";

    @Singular
    Map<PowerLutSlot, Lut> luts;

    public PowerArcKey key() {
        return new PowerArcKey(when, relatedPin, relatedPgPin);
    }

    public Lut lut(PowerLutSlot slot) {
        return luts.getOrDefault(slot, Lut.EMPTY);
    }
}
