package com.charlib.tool.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings and notes accumulated during one extraction or patch run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
