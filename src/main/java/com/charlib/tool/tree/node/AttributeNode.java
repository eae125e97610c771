package com.charlib.tool.tree.node;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import com.charlib.tool.exception.MalformedSourceException;
import com.charlib.tool.exception.TreeMutationException;
import com.charlib.tool.tree.AttributeType;
import com.charlib.tool.tree.AttributeValue;
import com.charlib.tool.tree.LibertyAttribute;
import com.charlib.tool.util.LibertyNumberFormat;

import lombok.Builder;
import lombok.Getter;

/**
 * Simple or complex attribute held by a {@link GroupNode}.
 * A simple attribute keeps exactly one value once set.
 */
@Getter
public class AttributeNode extends LibertyNode implements LibertyAttribute {

    private static final Pattern BARE_WORD = Pattern.compile("[A-Za-z0-9_.!\\-]+");

    private final String name;
    private final AttributeType type;
    private final List<AttributeValue> values;

    @Builder
    public AttributeNode(String name, AttributeType type, List<AttributeValue> values,
                         String sourceFile, int sourceLine, String sourceText, String leadingText) {
        super(sourceFile, sourceLine, sourceText, leadingText);
        this.name = name;
        this.type = type;
        this.values = values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    @Override
    public void accept(LibertyNodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public List<AttributeValue> getValues() {
        return Collections.unmodifiableList(values);
    }

    /**
     * The single value of a simple attribute, keeping its lexical kind.
     */
    public AttributeValue getScalar() {
        return values.isEmpty() ? AttributeValue.string("") : values.get(0);
    }

    @Override
    public String getStringValue() {
        return values.isEmpty() ? "" : values.get(0).text();
    }

    @Override
    public double getFloatValue() {
        String text = getStringValue().trim();
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new MalformedSourceException("Attribute '" + name + "' at " + getLocation()
                    + " is not a number: '" + text + "'", e);
        }
    }

    @Override
    public int getIntValue() {
        String text = getStringValue().trim();
        try {
            return new BigDecimal(text).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedSourceException("Attribute '" + name + "' at " + getLocation()
                    + " is not an integer: '" + text + "'", e);
        }
    }

    /**
     * Replaces the value, keeping it unquoted when the old value was unquoted and the new
     * one is a single bare word.
     */
    @Override
    public void setStringValue(String value) {
        requireAttached();
        requireType(AttributeType.SIMPLE, "set a scalar on");
        boolean unquoted = !values.isEmpty() && !values.get(0).isQuoted() && BARE_WORD.matcher(value).matches();
        values.clear();
        values.add(unquoted ? AttributeValue.word(value) : AttributeValue.string(value));
        markModified();
    }

    @Override
    public void setFloatValue(double value) {
        requireAttached();
        requireType(AttributeType.SIMPLE, "set a scalar on");
        values.clear();
        values.add(AttributeValue.number(LibertyNumberFormat.format(value)));
        markModified();
    }

    @Override
    public void addStringValue(String value) {
        requireAttached();
        requireType(AttributeType.COMPLEX, "append a value to");
        values.add(AttributeValue.string(value));
        markModified();
    }

    @Override
    public void addFloatValue(double value) {
        requireAttached();
        requireType(AttributeType.COMPLEX, "append a value to");
        values.add(AttributeValue.number(LibertyNumberFormat.format(value)));
        markModified();
    }

    private void requireType(AttributeType expected, String action) {
        if (type != expected) {
            throw new TreeMutationException("Cannot " + action + " " + type.name().toLowerCase()
                    + " attribute '" + name + "'");
        }
    }

    private void requireAttached() {
        if (parent == null) {
            throw new TreeMutationException("Attribute '" + name + "' is not attached to a group");
        }
    }

    @Override
    public String toString() {
        return "AttributeNode(" + name + ", " + type + ", " + values + ")";
    }
}
