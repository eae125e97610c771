package com.charlib.tool.util;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import lombok.experimental.UtilityClass;

/**
 * Deterministic number text for values written back into a Liberty tree.
 *
 * Finite values use the shortest decimal that {@link Double#toString(double)} proves
 * to round-trip, in plain notation and without trailing zeros ({@code 0.1}, {@code 2}, {@code 0.00015}).
 */
@UtilityClass
public class LibertyNumberFormat {

    public static final String SEPARATOR = ", ";

    public static String format(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0d) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String join(List<Double> values) {
        return values.stream()
                .map(LibertyNumberFormat::format)
                .collect(Collectors.joining(SEPARATOR));
    }
}
