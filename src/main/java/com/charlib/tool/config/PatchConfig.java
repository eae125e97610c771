package com.charlib.tool.config;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Validated settings of one patch run.
 */
@Value
@Builder
public class PatchConfig {

    @NonNull
    Path source;

    @NonNull
    Path edits;

    @NonNull
    Path output;
}
