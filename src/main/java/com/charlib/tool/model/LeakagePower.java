package com.charlib.tool.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One {@code leakage_power} group of a cell.
 */
@Value
@Builder(toBuilder = true)
public class LeakagePower {

    double value;

    @NonNull
    @Builder.Default
    String when = "";

    @NonNull
    @Builder.Default
    String relatedPgPin = "";

    public LeakageKey key() {
        return new LeakageKey(when, relatedPgPin);
    }
}
