package com.charlib.tool.codec;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.charlib.tool.diagnostics.ToolDiagnostics;
import com.charlib.tool.exception.MalformedDocumentException;
import com.charlib.tool.extract.LibraryProjector;
import com.charlib.tool.model.CapacitanceRange;
import com.charlib.tool.model.Cell;
import com.charlib.tool.model.InputPin;
import com.charlib.tool.model.LibrarySnapshot;
import com.charlib.tool.model.Lut;
import com.charlib.tool.model.OutputPin;
import com.charlib.tool.model.PowerArc;
import com.charlib.tool.model.PowerLutSlot;
import com.charlib.tool.model.ProcessCorner;
import com.charlib.tool.model.Pvt;
import com.charlib.tool.model.TimingArc;
import com.charlib.tool.model.TimingLutSlot;
import com.charlib.tool.parser.TextTreeEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Unit tests for the JSON interchange document.
 */
class InterchangeCodecTest {

    private final InterchangeCodec codec = new InterchangeCodec();

    @Test
    void testSampleLibraryRoundTrip() throws Exception {
        Path path = Path.of(getClass().getResource("/liberty/sample.lib").toURI());
        LibrarySnapshot snapshot = new LibraryProjector().project(
                TextTreeEngine.parse(Files.readString(path, StandardCharsets.UTF_8), "sample.lib").get(0),
                ProcessCorner.TT, new ToolDiagnostics());

        assertThat(codec.decode(codec.encode(snapshot, true))).isEqualTo(snapshot);
        assertThat(codec.decode(codec.encode(snapshot, false))).isEqualTo(snapshot);
    }

    @Test
    void testTopLevelFields() {
        LibrarySnapshot snapshot = LibrarySnapshot.builder()
                .pvt(Pvt.of(0.72, -40, ProcessCorner.FF))
                .build();

        ObjectNode document = codec.toDocument(snapshot);

        assertThat(document.get("voltage").doubleValue()).isEqualTo(0.72);
        assertThat(document.get("temperature").intValue()).isEqualTo(-40);
        assertThat(document.get("process").toString()).isEqualTo("[3]");
        assertThat(document.get("cells").isArray()).isTrue();
        assertThat(document.get("cells")).isEmpty();
    }

    @Test
    void testOneDimensionalLutOmitsIndex2() {
        Lut lut = Lut.of(List.of(0.1, 0.2), List.of(), List.of(List.of(1.0, 2.0), List.of(3.0, 4.0)));
        LibrarySnapshot snapshot = singleArc(TimingArc.builder()
                .relatedPin("A")
                .lut(TimingLutSlot.CELL_RISE, lut)
                .build());

        JsonNode cellRise = codec.toDocument(snapshot).at("/cells/0/output_pins/0/timing_arcs/0/cell_rise");

        assertThat(cellRise.has("index1")).isTrue();
        assertThat(cellRise.has("index2")).isFalse();
        assertThat(cellRise.get("values").toString()).isEqualTo("[[1.0,2.0],[3.0,4.0]]");

        Lut decoded = codec.decode(codec.encode(snapshot, false)).getCells().get(0).getOutputPins().get(0)
                .getTimingArcs().get(0).lut(TimingLutSlot.CELL_RISE);
        assertThat(decoded.getIndex1()).containsExactly(0.1, 0.2);
        assertThat(decoded.getValues()).containsExactly(List.of(1.0, 2.0), List.of(3.0, 4.0));
    }

    @Test
    void testAbsentFieldsAreOmitted() {
        LibrarySnapshot snapshot = LibrarySnapshot.builder()
                .pvt(Pvt.of(0.8, 25, ProcessCorner.TT))
                .cell(Cell.builder().cellName("EMPTY").build())
                .cell(Cell.builder()
                        .cellName("INV1")
                        .inputPin(InputPin.builder().pinName("A").build())
                        .outputPin(OutputPin.builder()
                                .pinName("Y")
                                .timingArc(TimingArc.builder().relatedPin("A").build())
                                .build())
                        .build())
                .build();

        JsonNode document = codec.toDocument(snapshot);

        assertThat(fieldNames(document.at("/cells/0"))).containsExactly("cell_name");
        assertThat(fieldNames(document.at("/cells/1/input_pins/0"))).containsExactly("pin_name");
        assertThat(fieldNames(document.at("/cells/1/output_pins/0"))).containsExactly("pin_name", "timing_arcs");
        assertThat(fieldNames(document.at("/cells/1/output_pins/0/timing_arcs/0"))).containsExactly("related_pin");
        assertThat(codec.encode(snapshot, false)).doesNotContain("null");
    }

    @Test
    void testPowerArcSlotsUseCellRiseAndCellFall() {
        Lut lut = Lut.of(List.of(0.01), List.of(), List.of(List.of(0.5)));
        LibrarySnapshot snapshot = LibrarySnapshot.builder()
                .pvt(Pvt.of(0.8, 25, ProcessCorner.TT))
                .cell(Cell.builder()
                        .cellName("INV1")
                        .outputPin(OutputPin.builder()
                                .pinName("Y")
                                .powerArc(PowerArc.builder().relatedPgPin("VDD").lut(PowerLutSlot.CELL_FALL, lut).build())
                                .build())
                        .build())
                .build();

        JsonNode arc = codec.toDocument(snapshot).at("/cells/0/output_pins/0/power_arcs/0");

        assertThat(fieldNames(arc)).containsExactly("related_pg_pin", "cell_fall");
        assertThat(codec.decode(codec.encode(snapshot, true))).isEqualTo(snapshot);
    }

    @Test
    void testHalfRangeIsWrittenWithZero() {
        LibrarySnapshot snapshot = LibrarySnapshot.builder()
                .pvt(Pvt.of(0.8, 25, ProcessCorner.TT))
                .cell(Cell.builder()
                        .cellName("INV1")
                        .inputPin(InputPin.builder()
                                .pinName("A")
                                .riseCapacitanceRange(CapacitanceRange.of(0.1, null))
                                .fallCapacitanceRange(CapacitanceRange.of(null, null))
                                .build())
                        .build())
                .build();

        JsonNode pin = codec.toDocument(snapshot).at("/cells/0/input_pins/0");

        assertThat(pin.get("rise_capacitance_range").toString()).isEqualTo("[0.1,0.0]");
        assertThat(pin.has("fall_capacitance_range")).isFalse();
    }

    @Test
    void testDecodeDefaultsLeakageValue() {
        LibrarySnapshot snapshot = codec.decode("""
                {
                  "voltage": 0.8,
                  "temperature": 25,
                  "process": [2],
                  "cells": [
                    {"cell_name": "INV1", "leakage_power": [{"when": "A"}]}
                  ]
                }
                """);

        assertThat(snapshot.getCells().get(0).getLeakagePowers().get(0).getValue()).isZero();
        assertThat(snapshot.getCells().get(0).getLeakagePowers().get(0).getRelatedPgPin()).isEmpty();
        assertThat(snapshot.getPvt().getProcess()).containsExactly(2);
    }

    @Test
    void testDecodeIgnoresUnknownFields() {
        LibrarySnapshot snapshot = codec.decode("""
                {"voltage": 1, "temperature": 0, "process": [], "comment": "x",
                 "cells": [{"cell_name": "A", "area": 1.2}]}
                """);

        assertThat(snapshot.getCells()).extracting(Cell::getCellName).containsExactly("A");
        assertThat(snapshot.getPvt().getVoltage()).isEqualTo(1.0);
    }

    @Test
    void testRejectsNonObjectDocument() {
        assertThatThrownBy(() -> codec.decode("[1, 2]"))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    void testRejectsInvalidJson() {
        assertThatThrownBy(() -> codec.decode("{\"cells\": ["))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void testRejectsNonArrayCells() {
        assertThatThrownBy(() -> codec.decode("{\"cells\": {}}"))
                .isInstanceOfSatisfying(MalformedDocumentException.class,
                        e -> assertThat(e.getPath()).isEqualTo("cells"));
    }

    @Test
    void testRejectsMissingCellName() {
        assertThatThrownBy(() -> codec.decode("{\"cells\": [{\"input_pins\": []}]}"))
                .isInstanceOfSatisfying(MalformedDocumentException.class,
                        e -> assertThat(e.getPath()).isEqualTo("cells[0].cell_name"));
    }

    @Test
    void testRejectsNonNumericLutValueWithPath() {
        String json = """
                {"cells": [{"cell_name": "INV1", "output_pins": [{"pin_name": "Y", "timing_arcs": [
                  {"related_pin": "A", "cell_rise": {"values": [[0.1, "x"]]}}]}]}]}
                """;

        assertThatThrownBy(() -> codec.decode(json))
                .isInstanceOfSatisfying(MalformedDocumentException.class, e -> assertThat(e.getPath())
                        .isEqualTo("cells[0].output_pins[0].timing_arcs[0].cell_rise.values[0][1]"))
                .hasMessageContaining("Expected a number");
    }

    @Test
    void testRejectsRangeWithWrongArity() {
        String json = """
                {"cells": [{"cell_name": "INV1", "input_pins": [
                  {"pin_name": "A", "rise_capacitance_range": [0.1, 0.2, 0.3]}]}]}
                """;

        assertThatThrownBy(() -> codec.decode(json))
                .isInstanceOfSatisfying(MalformedDocumentException.class,
                        e -> assertThat(e.getPath()).isEqualTo("cells[0].input_pins[0].rise_capacitance_range"));
    }

    @Test
    void testRejectsFractionalTemperature() {
        assertThatThrownBy(() -> codec.decode("{\"temperature\": 25.5}"))
                .isInstanceOfSatisfying(MalformedDocumentException.class,
                        e -> assertThat(e.getPath()).isEqualTo("temperature"));
    }

    @Test
    void testWriteEncodedDocument(@TempDir Path tempDir) throws Exception {
        LibrarySnapshot snapshot = LibrarySnapshot.builder().pvt(Pvt.of(0.8, 25, ProcessCorner.SS)).build();
        Path output = tempDir.resolve("nested/out.json");

        codec.write(codec.encode(snapshot, true), output);

        assertThat(codec.decode(output)).isEqualTo(snapshot);
        assertThat(Files.readString(output)).contains("\n  \"voltage\"");
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static LibrarySnapshot singleArc(TimingArc arc) {
        return LibrarySnapshot.builder()
                .pvt(Pvt.of(0.8, 25, ProcessCorner.TT))
                .cell(Cell.builder()
                        .cellName("INV1")
                        .outputPin(OutputPin.builder().pinName("Y").timingArc(arc).build())
                        .build())
                .build();
    }
}
