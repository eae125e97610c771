package com.charlib.tool.service;

import java.nio.file.Path;
import java.util.List;

import com.charlib.tool.model.LibrarySnapshot;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of an extraction run.
 */
@Data
@Builder
public class ExtractionResult {
    private boolean success;
    private String errorMessage;

    private LibrarySnapshot snapshot;
    private String document;
    private Path outputPath;

    private int cellsExtracted;
    private int timingArcsExtracted;
    private int powerArcsExtracted;

    @Singular
    private List<String> warnings;

    public static ExtractionResult failure(String errorMessage) {
        return ExtractionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
