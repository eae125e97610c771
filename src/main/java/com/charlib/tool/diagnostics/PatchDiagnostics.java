package com.charlib.tool.diagnostics;

import lombok.Getter;

/**
 * Counters for a patch pass. Lookup misses are not counted as failures; they simply
 * do not increment the matched counters.
 */
@Getter
public class PatchDiagnostics extends ToolDiagnostics {
    private int cellsMatched;
    private int pinsMatched;
    private int timingArcsMatched;
    private int powerArcsMatched;
    private int leakagesMatched;
    private int lutsRewritten;
    private int attributesWritten;
    private int attributeFailures;

    public void cellMatched() {
        cellsMatched++;
    }

    public void pinMatched() {
        pinsMatched++;
    }

    public void timingArcMatched() {
        timingArcsMatched++;
    }

    public void powerArcMatched() {
        powerArcsMatched++;
    }

    public void leakageMatched() {
        leakagesMatched++;
    }

    public void lutRewritten() {
        lutsRewritten++;
    }

    public void attributeWritten() {
        attributesWritten++;
    }

    /**
     * Records an abandoned attribute update.
     */
    public void attributeFailed(String message) {
        attributeFailures++;
        warn(message);
    }
}
