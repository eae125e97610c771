package com.charlib.tool.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A characterized cell with its pins and leakage conditions.
 */
@Value
@Builder(toBuilder = true)
public class Cell {

    @NonNull
    String cellName;

    @Singular
    List<OutputPin> outputPins;

    @Singular
    List<InputPin> inputPins;

    /**
     * Several leakage conditions per cell are legal.
     */
    @Singular
    List<LeakagePower> leakagePowers;

    public Optional<InputPin> findInputPin(String pinName) {
        return inputPins.stream().filter(p -> p.getPinName().equals(pinName)).findFirst();
    }

    public Optional<OutputPin> findOutputPin(String pinName) {
        return outputPins.stream().filter(p -> p.getPinName().equals(pinName)).findFirst();
    }

    public Optional<LeakagePower> findLeakage(LeakageKey key) {
        return leakagePowers.stream().filter(l -> l.key().equals(key)).findFirst();
    }
}
