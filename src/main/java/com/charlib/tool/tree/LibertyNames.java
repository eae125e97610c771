package com.charlib.tool.tree;

/**
 * Liberty group types and attribute names read or written by this tool.
 */
public final class LibertyNames {

    private LibertyNames() {
    }

    // Group types
    public static final String CELL = "cell";
    public static final String PIN = "pin";
    public static final String TIMING = "timing";
    public static final String INTERNAL_POWER = "internal_power";
    public static final String LEAKAGE_POWER = "leakage_power";

    // Library attributes
    public static final String NOM_VOLTAGE = "nom_voltage";
    public static final String NOM_TEMPERATURE = "nom_temperature";

    // Pin attributes
    public static final String DIRECTION = "direction";
    public static final String FUNCTION = "function";
    public static final String CAPACITANCE = "capacitance";
    public static final String RISE_CAPACITANCE = "rise_capacitance";
    public static final String FALL_CAPACITANCE = "fall_capacitance";
    public static final String RISE_CAPACITANCE_RANGE = "rise_capacitance_range";
    public static final String FALL_CAPACITANCE_RANGE = "fall_capacitance_range";

    // Arc and leakage attributes
    public static final String WHEN = "when";
    public static final String RELATED_PIN = "related_pin";
    public static final String RELATED_PG_PIN = "related_pg_pin";
    public static final String TIMING_TYPE = "timing_type";
    public static final String TIMING_SENSE = "timing_sense";
    public static final String VALUE = "value";

    // LUT attributes
    public static final String INDEX_1 = "index_1";
    public static final String INDEX_2 = "index_2";
    public static final String VALUES = "values";

    public static final String DIRECTION_INPUT = "input";
    public static final String DIRECTION_OUTPUT = "output";
}
