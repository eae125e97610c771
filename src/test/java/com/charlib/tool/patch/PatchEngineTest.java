package com.charlib.tool.patch;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.charlib.tool.codec.InterchangeCodec;
import com.charlib.tool.diagnostics.PatchDiagnostics;
import com.charlib.tool.diagnostics.ToolDiagnostics;
import com.charlib.tool.extract.LibraryProjector;
import com.charlib.tool.model.CapacitanceRange;
import com.charlib.tool.model.Cell;
import com.charlib.tool.model.InputPin;
import com.charlib.tool.model.LeakagePower;
import com.charlib.tool.model.LibrarySnapshot;
import com.charlib.tool.model.Lut;
import com.charlib.tool.model.OutputPin;
import com.charlib.tool.model.ProcessCorner;
import com.charlib.tool.model.Pvt;
import com.charlib.tool.model.TimingArc;
import com.charlib.tool.model.TimingLutSlot;
import com.charlib.tool.parser.LibertyWriter;
import com.charlib.tool.parser.TextTreeEngine;
import com.charlib.tool.tree.AttributeValue;
import com.charlib.tool.tree.LibertyGroup;
import com.charlib.tool.tree.node.GroupNode;

/**
 * Unit tests for PatchEngine on in-memory trees.
 */
class PatchEngineTest {

    private static final String INV1 = """
            library (lib) {
              cell (INV1) {
                pin (A) {
                  direction : input ;
                }
                pin (Y) {
                  direction : output ;
                  timing () {
                    related_pin : "A" ;
                    timing_type : combinational ;
                    cell_rise (tmpl) {
                      index_1 ("0.01, 0.02") ;
                      values ("0.1", \\
                              "0.2") ;
                    }
                  }
                }
              }
            }
            """;

    private final PatchEngine engine = new PatchEngine();
    private final InterchangeCodec codec = new InterchangeCodec();
    private final LibraryProjector projector = new LibraryProjector();

    @Test
    void testOmittedSlotIsErasedAndEditedSlotIsPopulated() {
        GroupNode library = parse(INV1);
        LibrarySnapshot edits = codec.decode("""
                {
                  "voltage": 0.8, "temperature": 25, "process": [2],
                  "cells": [{
                    "cell_name": "INV1",
                    "output_pins": [{
                      "pin_name": "Y",
                      "timing_arcs": [{
                        "related_pin": "A",
                        "timing_type": "combinational",
                        "cell_fall": {"index1": [0.01, 0.02], "values": [[0.3], [0.4]]}
                      }]
                    }]
                  }]
                }
                """);

        PatchDiagnostics diagnostics = engine.apply(library, edits);

        LibertyGroup timing = timingGroup(library, "INV1", "Y");
        LibertyGroup cellRise = timing.getGroups("cell_rise").get(0);
        assertThat(cellRise.findAttribute("index_1")).isEmpty();
        assertThat(cellRise.findAttribute("values")).isEmpty();

        LibertyGroup cellFall = timing.getGroups("cell_fall").get(0);
        assertThat(cellFall.findAttribute("index_1").orElseThrow().getValues())
                .containsExactly(AttributeValue.string("0.01, 0.02"));
        assertThat(cellFall.findAttribute("values").orElseThrow().getValues())
                .containsExactly(AttributeValue.string("0.3"), AttributeValue.string("0.4"));
        assertThat(cellFall.findAttribute("index_2")).isEmpty();

        TimingArc reExtracted = project(library).findCell("INV1").orElseThrow()
                .findOutputPin("Y").orElseThrow().getTimingArcs().get(0);
        assertThat(reExtracted.lut(TimingLutSlot.CELL_RISE).isPresent()).isFalse();
        assertThat(reExtracted.lut(TimingLutSlot.CELL_FALL).getValues()).containsExactly(List.of(0.3), List.of(0.4));

        assertThat(diagnostics.getCellsMatched()).isEqualTo(1);
        assertThat(diagnostics.getPinsMatched()).isEqualTo(1);
        assertThat(diagnostics.getTimingArcsMatched()).isEqualTo(1);
        assertThat(diagnostics.getLutsRewritten()).isEqualTo(2);
        assertThat(diagnostics.getAttributeFailures()).isZero();
    }

    @Test
    void testPatchingWithOwnExtractionChangesNothing() throws Exception {
        String source = Files.readString(sampleLibrary(), StandardCharsets.UTF_8);
        GroupNode library = parse(source);

        PatchDiagnostics diagnostics = engine.apply(library, project(library));

        assertThat(LibertyWriter.write(library)).isEqualTo(source);
        assertThat(diagnostics.getCellsMatched()).isEqualTo(2);
        assertThat(diagnostics.getLeakagesMatched()).isEqualTo(2);
        assertThat(diagnostics.getTimingArcsMatched()).isEqualTo(2);
        assertThat(diagnostics.getPowerArcsMatched()).isEqualTo(1);
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testCellsWithoutEditsAreUntouched() throws Exception {
        String source = Files.readString(sampleLibrary(), StandardCharsets.UTF_8);
        String bufSource = source.substring(source.indexOf("cell (\"BUF1\")"), source.lastIndexOf('}'));
        GroupNode library = parse(source);
        LibrarySnapshot edits = snapshotWith(Cell.builder()
                .cellName("INV1")
                .leakagePower(LeakagePower.builder().when("A").relatedPgPin("VDD").value(0.5).build())
                .build());

        PatchDiagnostics diagnostics = engine.apply(library, edits);

        assertThat(LibertyWriter.write(library)).contains(bufSource).contains("/* characterized 2024 */");
        assertThat(cellGroup(library, "BUF1").isVerbatim()).isTrue();
        assertThat(diagnostics.getCellsMatched()).isEqualTo(1);
        assertThat(diagnostics.getLeakagesMatched()).isEqualTo(1);
        assertThat(diagnostics.getTimingArcsMatched()).isZero();

        List<LeakagePower> leakages = project(library).findCell("INV1").orElseThrow().getLeakagePowers();
        assertThat(leakages).extracting(LeakagePower::getValue).containsExactly(0.5, 0.0021);
    }

    @Test
    void testApplyingSameEditsTwiceGivesSameText() {
        String source = """
                library (lib) {
                  cell (INV1) {
                    pin (A) {
                      direction : input ;
                      capacitance : 0.001 ;
                      rise_capacitance_range (0.001, 0.002) ;
                      max_transition : 0.5 ;
                    }
                    pin (Y) {
                      direction : output ;
                      timing () {
                        related_pin : "A" ;
                        timing_type : combinational ;
                        cell_rise (tmpl) {
                          index_1 ("0.01, 0.02") ;
                          values ("0.1", "0.2") ;
                        }
                      }
                    }
                  }
                }
                """;
        LibrarySnapshot edits = codec.decode("""
                {
                  "cells": [{
                    "cell_name": "INV1",
                    "input_pins": [{"pin_name": "A", "capacitance": 0.0025, "rise_capacitance_range": [0.0011, 0.0021]}],
                    "output_pins": [{
                      "pin_name": "Y",
                      "timing_arcs": [{
                        "related_pin": "A",
                        "timing_type": "combinational",
                        "cell_rise": {"index1": [0.01, 0.02], "values": [[0.15], [0.25]]},
                        "cell_fall": {"index1": [0.01, 0.02], "index2": [0.001], "values": [[0.3], [0.4]]}
                      }]
                    }]
                  }]
                }
                """);

        GroupNode once = parse(source);
        PatchDiagnostics first = engine.apply(once, edits);
        String onceText = LibertyWriter.write(once);

        GroupNode twice = parse(onceText);
        PatchDiagnostics second = engine.apply(twice, edits);

        assertThat(LibertyWriter.write(twice)).isEqualTo(onceText);
        assertThat(onceText).contains("cell_fall () {", "rise_capacitance_range (0.0011, 0.0021) ;", "capacitance : 0.0025 ;");
        assertThat(first.getInfos()).singleElement().asString().contains("INV1/Y/timing/cell_fall");
        assertThat(second.getInfos()).isEmpty();
        assertThat(second.getLutsRewritten()).isEqualTo(first.getLutsRewritten());
    }

    @Test
    void testUnnamedPinIsNotMatched() {
        GroupNode library = parse("""
                library (lib) {
                  cell (INV1) {
                    pin ("") {
                      direction : input ;
                      capacitance : 0.001 ;
                    }
                  }
                }
                """);
        String before = LibertyWriter.write(library);

        PatchDiagnostics diagnostics = engine.apply(library, snapshotWith(Cell.builder()
                .cellName("INV1")
                .inputPin(InputPin.builder().pinName("").capacitance(0.5).build())
                .build()));

        assertThat(diagnostics.getPinsMatched()).isZero();
        assertThat(LibertyWriter.write(library)).isEqualTo(before);
    }

    @Test
    void testUnknownCellIsLookupMiss() {
        GroupNode library = parse(INV1);
        String before = LibertyWriter.write(library);

        PatchDiagnostics diagnostics = engine.apply(library, snapshotWith(Cell.builder().cellName("NAND2").build()));

        assertThat(LibertyWriter.write(library)).isEqualTo(before);
        assertThat(diagnostics.getCellsMatched()).isZero();
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testFirstMatchingArcWins() {
        GroupNode library = parse(INV1);
        Lut first = Lut.of(List.of(1.0), List.of(), List.of(List.of(11.0)));
        Lut second = Lut.of(List.of(2.0), List.of(), List.of(List.of(22.0)));
        LibrarySnapshot edits = snapshotWith(Cell.builder()
                .cellName("INV1")
                .outputPin(OutputPin.builder()
                        .pinName("Y")
                        .timingArc(arcFromA().lut(TimingLutSlot.CELL_RISE, first).build())
                        .timingArc(arcFromA().lut(TimingLutSlot.CELL_RISE, second).build())
                        .build())
                .build());

        engine.apply(library, edits);

        LibertyGroup cellRise = timingGroup(library, "INV1", "Y").getGroups("cell_rise").get(0);
        assertThat(cellRise.findAttribute("values").orElseThrow().getValues())
                .containsExactly(AttributeValue.string("11"));
    }

    @Test
    void testArcKeyMismatchLeavesArcAlone() {
        GroupNode library = parse(INV1);
        String before = LibertyWriter.write(library);
        LibrarySnapshot edits = snapshotWith(Cell.builder()
                .cellName("INV1")
                .outputPin(OutputPin.builder()
                        .pinName("Y")
                        .timingArc(arcFromA().when("B").build())
                        .build())
                .build());

        PatchDiagnostics diagnostics = engine.apply(library, edits);

        assertThat(LibertyWriter.write(library)).isEqualTo(before);
        assertThat(diagnostics.getPinsMatched()).isEqualTo(1);
        assertThat(diagnostics.getTimingArcsMatched()).isZero();
    }

    @Test
    void testLeakageValueIsCreatedWhenMissing() {
        GroupNode library = parse("""
                library (lib) {
                  cell (INV1) {
                    leakage_power () {
                      when : "A" ;
                    }
                    leakage_power () {
                      when : "!A" ;
                      value : 1 ;
                    }
                  }
                }
                """);
        LibrarySnapshot edits = snapshotWith(Cell.builder()
                .cellName("INV1")
                .leakagePower(LeakagePower.builder().when("A").value(0.25).build())
                .build());

        engine.apply(library, edits);

        List<LibertyGroup> leakages = cellGroup(library, "INV1").getGroups("leakage_power");
        assertThat(leakages.get(0).findAttribute("value").orElseThrow().getFloatValue()).isEqualTo(0.25);
        assertThat(leakages.get(0).findAttribute("related_pg_pin")).isEmpty();
        assertThat(leakages.get(1).findAttribute("value").orElseThrow().getStringValue()).isEqualTo("1");
    }

    @Test
    void testCapacitanceScalarsOnlyOverwriteExistingAttributes() {
        GroupNode library = parse("""
                library (lib) {
                  cell (INV1) {
                    pin (A) {
                      direction : input ;
                      capacitance : 0.001 ;
                      fall_capacitance_range (0.1, 0.2) ;
                    }
                  }
                }
                """);
        LibrarySnapshot edits = snapshotWith(Cell.builder()
                .cellName("INV1")
                .inputPin(InputPin.builder()
                        .pinName("A")
                        .capacitance(0.0025)
                        .riseCapacitance(0.003)
                        .riseCapacitanceRange(CapacitanceRange.of(0.0024, 0.0026))
                        .build())
                .build());

        engine.apply(library, edits);

        InputPin pin = project(library).findCell("INV1").orElseThrow().findInputPin("A").orElseThrow();
        assertThat(pin.getCapacitance()).isEqualTo(0.0025);
        assertThat(pin.getRiseCapacitance()).isNull();
        assertThat(pin.getRiseCapacitanceRange()).isEqualTo(CapacitanceRange.of(0.0024, 0.0026));
        assertThat(pin.getFallCapacitanceRange()).isEqualTo(CapacitanceRange.of(0.1, 0.2));
    }

    @Test
    void testMutationFailureIsRecordedAndPatchContinues() {
        GroupNode library = parse("""
                library (lib) {
                  cell (INV1) {
                    leakage_power () {
                      when : "A" ;
                      value (0.1) ;
                    }
                    pin (A) {
                      direction : input ;
                      capacitance : 0.001 ;
                    }
                  }
                }
                """);
        LibrarySnapshot edits = snapshotWith(Cell.builder()
                .cellName("INV1")
                .leakagePower(LeakagePower.builder().when("A").value(0.5).build())
                .inputPin(InputPin.builder().pinName("A").capacitance(0.002).build())
                .build());

        PatchDiagnostics diagnostics = engine.apply(library, edits);

        assertThat(diagnostics.getAttributeFailures()).isEqualTo(1);
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("INV1/leakage_power.value");

        assertThat(diagnostics.getLeakagesMatched()).isEqualTo(1);
        LibertyGroup leakage = cellGroup(library, "INV1").getGroups("leakage_power").get(0);
        assertThat(leakage.findAttribute("value").orElseThrow().getValues()).containsExactly(AttributeValue.number("0.1"));
        assertThat(leakage.findAttribute("when").orElseThrow().getStringValue()).isEqualTo("A");
        LibertyGroup pin = cellGroup(library, "INV1").getGroups("pin").get(0);
        assertThat(pin.findAttribute("capacitance").orElseThrow().getFloatValue()).isEqualTo(0.002);
    }

    @Test
    void testPinsWithOtherDirectionsAreSkipped() {
        GroupNode library = parse("""
                library (lib) {
                  cell (INV1) {
                    pin (IO) {
                      direction : inout ;
                    }
                  }
                }
                """);

        PatchDiagnostics diagnostics = engine.apply(library, snapshotWith(Cell.builder().cellName("INV1").build()));

        assertThat(diagnostics.getPinsMatched()).isZero();
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("INV1/IO");
    }

    private static TimingArc.TimingArcBuilder arcFromA() {
        return TimingArc.builder().relatedPin("A").timingType("combinational");
    }

    private LibrarySnapshot project(LibertyGroup library) {
        return projector.project(library, ProcessCorner.TT, new ToolDiagnostics());
    }

    private static LibrarySnapshot snapshotWith(Cell cell) {
        return LibrarySnapshot.builder().pvt(Pvt.of(0.8, 25, ProcessCorner.TT)).cell(cell).build();
    }

    private static GroupNode parse(String source) {
        return TextTreeEngine.parse(source, "patch.lib").get(0);
    }

    private static GroupNode cellGroup(GroupNode library, String name) {
        return (GroupNode) library.getGroups("cell").stream()
                .filter(g -> g.getFirstName().orElse("").equals(name))
                .findFirst()
                .orElseThrow();
    }

    private static LibertyGroup timingGroup(GroupNode library, String cell, String pin) {
        return cellGroup(library, cell).getGroups("pin").stream()
                .filter(g -> g.getFirstName().orElse("").equals(pin))
                .findFirst()
                .orElseThrow()
                .getGroups("timing").get(0);
    }

    private static Path sampleLibrary() throws Exception {
        return Path.of(PatchEngineTest.class.getResource("/liberty/sample.lib").toURI());
    }
}
