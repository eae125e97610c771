package com.charlib.tool.tree;

import java.util.List;

import com.charlib.tool.exception.MalformedSourceException;
import com.charlib.tool.exception.TreeMutationException;

/**
 * A named attribute inside a {@link LibertyGroup}.
 *
 * Scalar accessors apply to {@link AttributeType#SIMPLE} attributes, value-list
 * accessors to {@link AttributeType#COMPLEX} ones. Mutators throw
 * {@link TreeMutationException} when used on the wrong shape.
 */
public interface LibertyAttribute {

    String getName();

    AttributeType getType();

    /**
     * Raw text of a simple attribute, without quotes.
     */
    String getStringValue();

    /**
     * @throws MalformedSourceException if the value is not a number
     */
    double getFloatValue();

    /**
     * @throws MalformedSourceException if the value is not an integral number
     */
    int getIntValue();

    /**
     * Values of a complex attribute in source order. Empty for simple attributes.
     */
    List<AttributeValue> getValues();

    void setStringValue(String value);

    void setFloatValue(double value);

    void addStringValue(String value);

    void addFloatValue(double value);
}
