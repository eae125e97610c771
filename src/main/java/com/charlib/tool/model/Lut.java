package com.charlib.tool.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Lookup table with optional index axes and row-major values.
 *
 * Row/column counts are not checked against the axes; 1-D tables carry only
 * {@code index1} and {@code values}.
 */
@Value
public class Lut {

    public static final Lut EMPTY = new Lut(List.of(), List.of(), List.of());

    List<Double> index1;
    List<Double> index2;
    List<List<Double>> values;

    @Builder(toBuilder = true)
    public Lut(List<Double> index1, List<Double> index2, List<List<Double>> values) {
        this.index1 = index1 != null ? List.copyOf(index1) : List.of();
        this.index2 = index2 != null ? List.copyOf(index2) : List.of();
        List<List<Double>> rows = new ArrayList<>();
        if (values != null) {
            for (List<Double> row : values) {
                rows.add(List.copyOf(row));
            }
        }
        this.values = List.copyOf(rows);
    }

    public static Lut of(List<Double> index1, List<Double> index2, List<List<Double>> values) {
        return new Lut(index1, index2, values);
    }

    /**
     * A slot is present iff at least one of its fields is non-empty.
     */
    public boolean isPresent() {
        return !index1.isEmpty() || !index2.isEmpty() || !values.isEmpty();
    }
}
