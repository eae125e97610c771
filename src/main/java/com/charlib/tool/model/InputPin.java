package com.charlib.tool.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A pin with {@code direction : input}. Null capacitance fields are absent in the source.
 */
@Value
@Builder(toBuilder = true)
public class InputPin implements ArcOwner {

    @NonNull
    String pinName;

    Double capacitance;
    Double riseCapacitance;
    Double fallCapacitance;
    CapacitanceRange riseCapacitanceRange;
    CapacitanceRange fallCapacitanceRange;

    @Singular
    List<TimingArc> timingArcs;

    @Singular
    List<PowerArc> powerArcs;
}
