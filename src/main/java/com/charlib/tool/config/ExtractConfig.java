package com.charlib.tool.config;

import java.nio.file.Path;

import com.charlib.tool.model.ProcessCorner;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Validated settings of one extraction run.
 */
@Value
@Builder
public class ExtractConfig {

    @NonNull
    Path source;

    @NonNull
    @Builder.Default
    ProcessCorner corner = ProcessCorner.TT;

    /**
     * Destination of the interchange document; null keeps it in the result only.
     */
    Path output;

    @Builder.Default
    boolean pretty = true;
}
