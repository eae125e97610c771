package com.charlib.tool.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.exception.LibertyToolException;
import com.charlib.tool.tree.LibertyGroup;
import com.charlib.tool.tree.LibertyTree;
import com.charlib.tool.tree.node.GroupNode;
import com.charlib.tool.util.FileWriteUtil;

/**
 * Session over a Liberty file parsed into memory by {@link TextTreeEngine}.
 */
public class TextLibertyTree implements LibertyTree {
    private static final Logger log = LoggerFactory.getLogger(TextLibertyTree.class);

    private final Path source;
    private final List<GroupNode> topGroups;
    private boolean closed;

    public TextLibertyTree(Path source, List<GroupNode> topGroups) {
        this.source = source;
        this.topGroups = List.copyOf(topGroups);
    }

    @Override
    public Path getSource() {
        return source;
    }

    @Override
    public List<LibertyGroup> getTopGroups() {
        requireOpen();
        return new ArrayList<>(topGroups);
    }

    @Override
    public void write(LibertyGroup group, Path destination) {
        requireOpen();
        if (!(group instanceof GroupNode root)) {
            throw new IllegalArgumentException("Group was not produced by this engine: " + group);
        }
        String text = LibertyWriter.write(root);
        try {
            FileWriteUtil.writeAtomically(destination, text);
        } catch (IOException e) {
            throw new LibertyToolException("Failed to write Liberty file " + destination + ": " + e.getMessage(), e);
        }
        log.info("Wrote Liberty file: {}", destination);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Closed Liberty session for {}", source);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Liberty session for " + source + " is already closed");
        }
    }
}
