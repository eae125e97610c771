package com.charlib.tool.codec;

/**
 * Field names of the interchange document.
 */
final class InterchangeFields {

    private InterchangeFields() {
    }

    static final String VOLTAGE = "voltage";
    static final String TEMPERATURE = "temperature";
    static final String PROCESS = "process";
    static final String CELLS = "cells";

    static final String CELL_NAME = "cell_name";
    static final String OUTPUT_PINS = "output_pins";
    static final String INPUT_PINS = "input_pins";
    static final String LEAKAGE_POWER = "leakage_power";

    static final String PIN_NAME = "pin_name";
    static final String FUNCTION = "function";
    static final String CAPACITANCE = "capacitance";
    static final String RISE_CAPACITANCE = "rise_capacitance";
    static final String FALL_CAPACITANCE = "fall_capacitance";
    static final String RISE_CAPACITANCE_RANGE = "rise_capacitance_range";
    static final String FALL_CAPACITANCE_RANGE = "fall_capacitance_range";
    static final String TIMING_ARCS = "timing_arcs";
    static final String POWER_ARCS = "power_arcs";

    static final String WHEN = "when";
    static final String RELATED_PIN = "related_pin";
    static final String RELATED_PG_PIN = "related_pg_pin";
    static final String TIMING_TYPE = "timing_type";
    static final String TIMING_SENSE = "timing_sense";
    static final String VALUE = "value";

    static final String INDEX1 = "index1";
    static final String INDEX2 = "index2";
    static final String VALUES = "values";
}
