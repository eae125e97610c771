package com.charlib.tool.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything extracted from (or decoded for) one library scope.
 *
 * Built once per extraction or decode and never mutated afterwards, so it may be
 * read from several threads.
 */
@Value
@Builder(toBuilder = true)
public class LibrarySnapshot {

    @NonNull
    Pvt pvt;

    @Singular
    List<Cell> cells;

    public Optional<Cell> findCell(String cellName) {
        return cells.stream().filter(c -> c.getCellName().equals(cellName)).findFirst();
    }

    public int countTimingArcs() {
        int count = 0;
        for (Cell cell : cells) {
            for (OutputPin pin : cell.getOutputPins()) {
                count += pin.getTimingArcs().size();
            }
            for (InputPin pin : cell.getInputPins()) {
                count += pin.getTimingArcs().size();
            }
        }
        return count;
    }

    public int countPowerArcs() {
        int count = 0;
        for (Cell cell : cells) {
            for (OutputPin pin : cell.getOutputPins()) {
                count += pin.getPowerArcs().size();
            }
            for (InputPin pin : cell.getInputPins()) {
                count += pin.getPowerArcs().size();
            }
        }
        return count;
    }
}
