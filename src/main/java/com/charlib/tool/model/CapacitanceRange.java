package com.charlib.tool.model;

import lombok.Value;

/**
 * Lower/upper bound pair of a {@code *_capacitance_range} attribute. Either bound may be null.
 */
@Value(staticConstructor = "of")
public class CapacitanceRange {
    Double lower;
    Double upper;

    public boolean isPresent() {
        return lower != null || upper != null;
    }
}
