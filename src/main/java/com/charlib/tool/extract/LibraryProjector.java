package com.charlib.tool.extract;

import static com.charlib.tool.tree.LibertyNames.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.diagnostics.ToolDiagnostics;
import com.charlib.tool.exception.MalformedSourceException;
import com.charlib.tool.model.CapacitanceRange;
import com.charlib.tool.model.Cell;
import com.charlib.tool.model.InputPin;
import com.charlib.tool.model.LeakagePower;
import com.charlib.tool.model.LibrarySnapshot;
import com.charlib.tool.model.Lut;
import com.charlib.tool.model.OutputPin;
import com.charlib.tool.model.PowerArc;
import com.charlib.tool.model.PowerLutSlot;
import com.charlib.tool.model.ProcessCorner;
import com.charlib.tool.model.Pvt;
import com.charlib.tool.model.TimingArc;
import com.charlib.tool.model.TimingLutSlot;
import com.charlib.tool.tree.LibertyAttribute;
import com.charlib.tool.tree.LibertyGroup;

/**
 * Projects a library group of the attribute tree onto a {@link LibrarySnapshot}.
 *
 * Depth-first, dispatching on group type only. Unknown group types are skipped.
 * Absent attributes leave the corresponding field unset; a present attribute that is
 * not numeric where a number is expected aborts the projection with
 * {@link MalformedSourceException}.
 */
public class LibraryProjector {
    private static final Logger log = LoggerFactory.getLogger(LibraryProjector.class);

    public LibrarySnapshot project(LibertyGroup library, ProcessCorner corner, ToolDiagnostics diagnostics) {
        Pvt pvt = Pvt.builder()
                .voltage(library.findAttribute(NOM_VOLTAGE).map(LibertyAttribute::getFloatValue).orElse(0.0))
                .temperature(library.findAttribute(NOM_TEMPERATURE).map(LibertyAttribute::getIntValue).orElse(0))
                .process(corner.getEncoding())
                .build();

        LibrarySnapshot.LibrarySnapshotBuilder snapshot = LibrarySnapshot.builder().pvt(pvt);
        for (LibertyGroup group : library.getGroups()) {
            if (CELL.equals(group.getGroupType())) {
                snapshot.cell(projectCell(group, diagnostics));
            }
        }

        LibrarySnapshot result = snapshot.build();
        log.debug("Projected {} cells from library {}", result.getCells().size(), library.getNames());
        return result;
    }

    private Cell projectCell(LibertyGroup cellGroup, ToolDiagnostics diagnostics) {
        String cellName = cellGroup.getFirstName().orElse("");
        Cell.CellBuilder cell = Cell.builder().cellName(cellName);
        List<LibertyGroup> children = cellGroup.getGroups();

        for (LibertyGroup child : children) {
            if (PIN.equals(child.getGroupType())) {
                projectPin(cellName, child, cell, diagnostics);
            }
        }
        // leakage_power groups are siblings of the pins and are read after them
        for (LibertyGroup child : children) {
            if (LEAKAGE_POWER.equals(child.getGroupType())) {
                cell.leakagePower(projectLeakage(child));
            }
        }

        log.debug("Projected cell {}", cellName);
        return cell.build();
    }

    private void projectPin(String cellName, LibertyGroup pinGroup, Cell.CellBuilder cell,
                            ToolDiagnostics diagnostics) {
        String pinName = pinGroup.getFirstName().orElse("");
        String direction = stringAttribute(pinGroup, DIRECTION);

        switch (direction) {
            case DIRECTION_OUTPUT -> cell.outputPin(projectOutputPin(pinName, pinGroup));
            case DIRECTION_INPUT -> cell.inputPin(projectInputPin(pinName, pinGroup));
            default -> {
                // inout/internal pins have no model counterpart yet
                String message = "Skipped pin " + cellName + "/" + pinName + " with direction '" + direction + "'";
                log.warn(message);
                diagnostics.warn(message);
            }
        }
    }

    private OutputPin projectOutputPin(String pinName, LibertyGroup pinGroup) {
        OutputPin.OutputPinBuilder pin = OutputPin.builder()
                .pinName(pinName)
                .function(stringAttribute(pinGroup, FUNCTION));
        for (LibertyGroup child : pinGroup.getGroups()) {
            switch (child.getGroupType()) {
                case TIMING -> pin.timingArc(projectTimingArc(child));
                case INTERNAL_POWER -> pin.powerArc(projectPowerArc(child));
                default -> {
                }
            }
        }
        return pin.build();
    }

    private InputPin projectInputPin(String pinName, LibertyGroup pinGroup) {
        InputPin.InputPinBuilder pin = InputPin.builder()
                .pinName(pinName)
                .capacitance(floatAttribute(pinGroup, CAPACITANCE))
                .riseCapacitance(floatAttribute(pinGroup, RISE_CAPACITANCE))
                .fallCapacitance(floatAttribute(pinGroup, FALL_CAPACITANCE))
                .riseCapacitanceRange(rangeAttribute(pinGroup, RISE_CAPACITANCE_RANGE))
                .fallCapacitanceRange(rangeAttribute(pinGroup, FALL_CAPACITANCE_RANGE));
        for (LibertyGroup child : pinGroup.getGroups()) {
            switch (child.getGroupType()) {
                case TIMING -> pin.timingArc(projectTimingArc(child));
                case INTERNAL_POWER -> pin.powerArc(projectPowerArc(child));
                default -> {
                }
            }
        }
        return pin.build();
    }

    private TimingArc projectTimingArc(LibertyGroup timingGroup) {
        Map<TimingLutSlot, Lut> luts = new EnumMap<>(TimingLutSlot.class);
        for (LibertyGroup child : timingGroup.getGroups()) {
            TimingLutSlot.fromGroupType(child.getGroupType()).ifPresent(slot -> {
                Lut lut = projectLut(child);
                if (lut.isPresent()) {
                    luts.put(slot, lut);
                }
            });
        }
        return TimingArc.builder()
                .when(stringAttribute(timingGroup, WHEN))
                .relatedPin(stringAttribute(timingGroup, RELATED_PIN))
                .timingType(stringAttribute(timingGroup, TIMING_TYPE))
                .timingSense(stringAttribute(timingGroup, TIMING_SENSE))
                .luts(luts)
                .build();
    }

    private PowerArc projectPowerArc(LibertyGroup powerGroup) {
        Map<PowerLutSlot, Lut> luts = new EnumMap<>(PowerLutSlot.class);
        for (LibertyGroup child : powerGroup.getGroups()) {
            PowerLutSlot.fromGroupType(child.getGroupType()).ifPresent(slot -> {
                Lut lut = projectLut(child);
                if (lut.isPresent()) {
                    luts.put(slot, lut);
                }
            });
        }
        return PowerArc.builder()
                .when(stringAttribute(powerGroup, WHEN))
                .relatedPin(stringAttribute(powerGroup, RELATED_PIN))
                .relatedPgPin(stringAttribute(powerGroup, RELATED_PG_PIN))
                .luts(luts)
                .build();
    }

    private LeakagePower projectLeakage(LibertyGroup leakageGroup) {
        return LeakagePower.builder()
                .value(leakageGroup.findAttribute(VALUE).map(LibertyAttribute::getFloatValue).orElse(0.0))
                .when(stringAttribute(leakageGroup, WHEN))
                .relatedPgPin(stringAttribute(leakageGroup, RELATED_PG_PIN))
                .build();
    }

    static Lut projectLut(LibertyGroup lutGroup) {
        Lut.LutBuilder lut = Lut.builder();
        lutGroup.findAttribute(INDEX_1).ifPresent(a -> lut.index1(LutValueParser.parseAxis(a)));
        lutGroup.findAttribute(INDEX_2).ifPresent(a -> lut.index2(LutValueParser.parseAxis(a)));
        lutGroup.findAttribute(VALUES).ifPresent(a -> lut.values(LutValueParser.parseRows(a)));
        return lut.build();
    }

    private static String stringAttribute(LibertyGroup group, String name) {
        return group.findAttribute(name).map(LibertyAttribute::getStringValue).orElse("");
    }

    private static Double floatAttribute(LibertyGroup group, String name) {
        return group.findAttribute(name).map(LibertyAttribute::getFloatValue).orElse(null);
    }

    /**
     * Only a two-number attribute yields a range.
     */
    private static CapacitanceRange rangeAttribute(LibertyGroup group, String name) {
        return group.findAttribute(name)
                .map(LutValueParser::parseAxis)
                .filter(values -> values.size() == 2)
                .map(values -> CapacitanceRange.of(values.get(0), values.get(1)))
                .orElse(null);
    }
}
