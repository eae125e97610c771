package com.charlib.tool.tree;

import java.nio.file.Path;

import com.charlib.tool.exception.MalformedSourceException;
import com.charlib.tool.exception.SourceReadException;

/**
 * Opens Liberty sources into traversable trees.
 */
public interface TreeEngine {

    /**
     * @throws SourceReadException if the source cannot be read
     * @throws MalformedSourceException if the source cannot be parsed
     */
    LibertyTree open(Path source);
}
