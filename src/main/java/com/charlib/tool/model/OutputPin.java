package com.charlib.tool.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A pin with {@code direction : output}.
 */
@Value
@Builder(toBuilder = true)
public class OutputPin implements ArcOwner {

    @NonNull
    String pinName;

    @NonNull
    @Builder.Default
    String function = "";

    @Singular
    List<TimingArc> timingArcs;

    @Singular
    List<PowerArc> powerArcs;
}
