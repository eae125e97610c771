package com.charlib.tool.extract;

import java.util.ArrayList;
import java.util.List;

import com.charlib.tool.exception.MalformedSourceException;
import com.charlib.tool.tree.AttributeValue;
import com.charlib.tool.tree.LibertyAttribute;
import com.charlib.tool.tree.ValueKind;

import lombok.experimental.UtilityClass;

/**
 * Reads numeric axes and value blocks out of complex attributes.
 *
 * Quoted values are split on commas and line breaks with empty tokens skipped;
 * unquoted values are single numbers.
 */
@UtilityClass
public class LutValueParser {

    /**
     * Flattens every value of {@code attribute} into one axis, e.g. {@code index_1("0.1, 0.2")}.
     */
    public static List<Double> parseAxis(LibertyAttribute attribute) {
        List<Double> result = new ArrayList<>();
        for (AttributeValue value : attribute.getValues()) {
            if (value.kind() == ValueKind.STRING) {
                for (String token : value.text().split("[,\\n]")) {
                    addToken(result, token, attribute);
                }
            } else {
                addToken(result, value.text(), attribute);
            }
        }
        return result;
    }

    /**
     * Reads a value block: each line of each quoted value is one row.
     * Unquoted numbers are gathered into a single row.
     */
    public static List<List<Double>> parseRows(LibertyAttribute attribute) {
        List<List<Double>> rows = new ArrayList<>();
        List<Double> bareRow = new ArrayList<>();

        for (AttributeValue value : attribute.getValues()) {
            if (value.kind() != ValueKind.STRING) {
                addToken(bareRow, value.text(), attribute);
                continue;
            }
            for (String line : value.text().split("\\n")) {
                List<Double> row = new ArrayList<>();
                for (String token : line.split(",")) {
                    addToken(row, token, attribute);
                }
                if (!row.isEmpty()) {
                    rows.add(row);
                }
            }
        }

        if (!bareRow.isEmpty()) {
            rows.add(bareRow);
        }
        return rows;
    }

    private static void addToken(List<Double> target, String token, LibertyAttribute attribute) {
        String trimmed = token.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        try {
            target.add(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            throw new MalformedSourceException("Attribute '" + attribute.getName()
                    + "' contains a non-numeric token: '" + trimmed + "'", e);
        }
    }
}
