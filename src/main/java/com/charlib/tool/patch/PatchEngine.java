package com.charlib.tool.patch;

import static com.charlib.tool.tree.LibertyNames.*;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.diagnostics.PatchDiagnostics;
import com.charlib.tool.exception.TreeMutationException;
import com.charlib.tool.model.ArcOwner;
import com.charlib.tool.model.CapacitanceRange;
import com.charlib.tool.model.Cell;
import com.charlib.tool.model.InputPin;
import com.charlib.tool.model.LeakageKey;
import com.charlib.tool.model.LeakagePower;
import com.charlib.tool.model.LibrarySnapshot;
import com.charlib.tool.model.Lut;
import com.charlib.tool.model.PowerArc;
import com.charlib.tool.model.PowerArcKey;
import com.charlib.tool.model.PowerLutSlot;
import com.charlib.tool.model.TimingArc;
import com.charlib.tool.model.TimingArcKey;
import com.charlib.tool.model.TimingLutSlot;
import com.charlib.tool.tree.AttributeType;
import com.charlib.tool.tree.LibertyAttribute;
import com.charlib.tool.tree.LibertyGroup;

/**
 * Applies the values of a {@link LibrarySnapshot} onto a library group in place.
 *
 * <p>The tree drives the walk: cells, leakages, pins and arcs are matched to the snapshot
 * by identity key and only matched entities are touched. A tree entity without a snapshot
 * counterpart is left as it is. When several snapshot arcs share a key the first one wins.</p>
 *
 * <p>Every LUT slot of a matched arc is rewritten, including slots the snapshot leaves empty;
 * those lose their data. A slot with data but no group in the tree gets a new group.
 * A failed attribute mutation abandons only that attribute and is recorded in the returned
 * {@link PatchDiagnostics}.</p>
 */
public class PatchEngine {
    private static final Logger log = LoggerFactory.getLogger(PatchEngine.class);

    public PatchDiagnostics apply(LibertyGroup library, LibrarySnapshot snapshot) {
        PatchDiagnostics diagnostics = new PatchDiagnostics();
        LutWriter lutWriter = new LutWriter(diagnostics);

        for (LibertyGroup cellGroup : library.getGroups(CELL)) {
            Optional<String> cellName = cellGroup.getFirstName().filter(name -> !name.isEmpty());
            if (cellName.isEmpty()) {
                log.debug("Skipping unnamed cell group");
                continue;
            }
            Optional<Cell> cell = snapshot.findCell(cellName.get());
            if (cell.isEmpty()) {
                log.debug("No edits for cell {}", cellName.get());
                continue;
            }
            diagnostics.cellMatched();
            new CellPatcher(cell.get(), diagnostics, lutWriter).patch(cellGroup);
        }
        return diagnostics;
    }

    /**
     * Patch state of one matched cell.
     */
    private static class CellPatcher {
        private final Cell cell;
        private final PatchDiagnostics diagnostics;
        private final LutWriter lutWriter;

        CellPatcher(Cell cell, PatchDiagnostics diagnostics, LutWriter lutWriter) {
            this.cell = cell;
            this.diagnostics = diagnostics;
            this.lutWriter = lutWriter;
        }

        void patch(LibertyGroup cellGroup) {
            for (LibertyGroup leakageGroup : cellGroup.getGroups(LEAKAGE_POWER)) {
                patchLeakage(leakageGroup);
            }
            for (LibertyGroup pinGroup : cellGroup.getGroups(PIN)) {
                patchPin(pinGroup);
            }
        }

        private void patchLeakage(LibertyGroup leakageGroup) {
            LeakageKey key = new LeakageKey(readString(leakageGroup, WHEN), readString(leakageGroup, RELATED_PG_PIN));
            Optional<LeakagePower> match = cell.findLeakage(key);
            if (match.isEmpty()) {
                return;
            }
            diagnostics.leakageMatched();
            LeakagePower leakage = match.get();
            String location = cell.getCellName() + "/leakage_power";

            upsert(leakageGroup, VALUE, location, a -> a.setFloatValue(leakage.getValue()));
            if (!leakage.getWhen().isEmpty()) {
                upsert(leakageGroup, WHEN, location, a -> a.setStringValue(leakage.getWhen()));
            }
            if (!leakage.getRelatedPgPin().isEmpty()) {
                upsert(leakageGroup, RELATED_PG_PIN, location, a -> a.setStringValue(leakage.getRelatedPgPin()));
            }
        }

        private void patchPin(LibertyGroup pinGroup) {
            String pinName = pinGroup.getFirstName().orElse("");
            if (pinName.isEmpty()) {
                log.debug("Skipping unnamed pin group in cell {}", cell.getCellName());
                return;
            }
            String direction = readString(pinGroup, DIRECTION);
            String location = cell.getCellName() + "/" + pinName;

            switch (direction) {
                case DIRECTION_INPUT -> cell.findInputPin(pinName).ifPresent(pin -> {
                    diagnostics.pinMatched();
                    patchCapacitance(pinGroup, pin, location);
                    patchArcs(pinGroup, pin, location);
                });
                case DIRECTION_OUTPUT -> cell.findOutputPin(pinName).ifPresent(pin -> {
                    diagnostics.pinMatched();
                    patchArcs(pinGroup, pin, location);
                });
                default -> {
                    String message = "Skipped pin " + location + " with direction '" + direction + "'";
                    log.warn(message);
                    diagnostics.warn(message);
                }
            }
        }

        /**
         * Scalars are only overwritten where the tree already has them; ranges are recreated.
         */
        private void patchCapacitance(LibertyGroup pinGroup, InputPin pin, String location) {
            setExisting(pinGroup, CAPACITANCE, pin.getCapacitance(), location);
            setExisting(pinGroup, RISE_CAPACITANCE, pin.getRiseCapacitance(), location);
            setExisting(pinGroup, FALL_CAPACITANCE, pin.getFallCapacitance(), location);
            replaceRange(pinGroup, RISE_CAPACITANCE_RANGE, pin.getRiseCapacitanceRange(), location);
            replaceRange(pinGroup, FALL_CAPACITANCE_RANGE, pin.getFallCapacitanceRange(), location);
        }

        private void setExisting(LibertyGroup group, String name, Double value, String location) {
            if (value == null) {
                return;
            }
            group.findAttribute(name).ifPresent(attribute -> attempt(location, name, () -> {
                attribute.setFloatValue(value);
                diagnostics.attributeWritten();
            }));
        }

        private void replaceRange(LibertyGroup group, String name, CapacitanceRange range, String location) {
            if (range == null || !range.isPresent()) {
                return;
            }
            attempt(location, name, () -> {
                group.findAttribute(name).ifPresent(group::deleteAttribute);
                LibertyAttribute attribute = group.createAttribute(name, AttributeType.COMPLEX);
                if (range.getLower() != null) {
                    attribute.addFloatValue(range.getLower());
                }
                if (range.getUpper() != null) {
                    attribute.addFloatValue(range.getUpper());
                }
                diagnostics.attributeWritten();
            });
        }

        private void patchArcs(LibertyGroup pinGroup, ArcOwner pin, String location) {
            for (LibertyGroup timingGroup : pinGroup.getGroups(TIMING)) {
                TimingArcKey key = new TimingArcKey(readString(timingGroup, WHEN),
                        readString(timingGroup, RELATED_PIN), readString(timingGroup, TIMING_TYPE));
                pin.findTimingArc(key).ifPresent(arc -> patchTimingArc(timingGroup, arc, location + "/timing"));
            }
            for (LibertyGroup powerGroup : pinGroup.getGroups(INTERNAL_POWER)) {
                PowerArcKey key = new PowerArcKey(readString(powerGroup, WHEN),
                        readString(powerGroup, RELATED_PIN), readString(powerGroup, RELATED_PG_PIN));
                pin.findPowerArc(key).ifPresent(arc -> patchPowerArc(powerGroup, arc, location + "/internal_power"));
            }
        }

        private void patchTimingArc(LibertyGroup timingGroup, TimingArc arc, String location) {
            diagnostics.timingArcMatched();
            for (TimingLutSlot slot : TimingLutSlot.values()) {
                rewriteSlot(timingGroup, slot.getGroupType(), arc.lut(slot), location);
            }
        }

        private void patchPowerArc(LibertyGroup powerGroup, PowerArc arc, String location) {
            diagnostics.powerArcMatched();
            for (PowerLutSlot slot : PowerLutSlot.values()) {
                rewriteSlot(powerGroup, slot.getGroupType(), arc.lut(slot), location);
            }
        }

        /**
         * Rewrites every LUT group of one slot. A slot with data but no group gets a new,
         * unnamed group.
         */
        private void rewriteSlot(LibertyGroup arcGroup, String lutGroupType, Lut lut, String location) {
            String lutLocation = location + "/" + lutGroupType;
            List<LibertyGroup> lutGroups = arcGroup.getGroups(lutGroupType);
            if (lutGroups.isEmpty() && lut.isPresent()) {
                try {
                    lutGroups = List.of(arcGroup.createGroup(lutGroupType, List.of()));
                    diagnostics.info("Created " + lutLocation);
                } catch (TreeMutationException e) {
                    String message = "Failed to create " + lutLocation + ": " + e.getMessage();
                    log.warn(message);
                    diagnostics.attributeFailed(message);
                    return;
                }
            }
            for (LibertyGroup lutGroup : lutGroups) {
                lutWriter.rewrite(lutGroup, lut, lutLocation);
            }
        }

        /**
         * Sets a simple attribute, creating it first when missing.
         */
        private void upsert(LibertyGroup group, String name, String location, Consumer<LibertyAttribute> setter) {
            attempt(location, name, () -> {
                LibertyAttribute attribute = group.findAttribute(name)
                        .orElseGet(() -> group.createAttribute(name, AttributeType.SIMPLE));
                setter.accept(attribute);
                diagnostics.attributeWritten();
            });
        }

        private void attempt(String location, String name, Runnable mutation) {
            try {
                mutation.run();
            } catch (TreeMutationException e) {
                String message = "Failed to update " + location + "." + name + ": " + e.getMessage();
                log.warn(message);
                diagnostics.attributeFailed(message);
            }
        }

        private static String readString(LibertyGroup group, String name) {
            return group.findAttribute(name).map(LibertyAttribute::getStringValue).orElse("");
        }
    }
}
