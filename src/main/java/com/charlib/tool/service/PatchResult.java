package com.charlib.tool.service;

import java.nio.file.Path;

import com.charlib.tool.diagnostics.PatchDiagnostics;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a patch run. Diagnostics are present whenever the traversal ran.
 */
@Data
@Builder
public class PatchResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private PatchDiagnostics diagnostics;

    public static PatchResult failure(String errorMessage) {
        return PatchResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
