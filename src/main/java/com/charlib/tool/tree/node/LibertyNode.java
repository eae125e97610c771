package com.charlib.tool.tree.node;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Base class for in-memory Liberty tree nodes.
 *
 * Parsed nodes keep their exact source text and the text between them and their previous
 * sibling. The writer reuses both for every node that was never modified, so untouched
 * parts of a library come out byte for byte.
 */
@Getter
public abstract class LibertyNode {

    @Setter(AccessLevel.PACKAGE)
    protected GroupNode parent;
    protected final String sourceFile;
    protected final int sourceLine;
    /** Null for nodes created after parsing. */
    protected final String sourceText;
    /** Whitespace and comments ahead of the node; null for nodes created after parsing. */
    protected final String leadingText;
    private boolean modified;

    protected LibertyNode(String sourceFile, int sourceLine, String sourceText, String leadingText) {
        this.sourceFile = sourceFile;
        this.sourceLine = sourceLine;
        this.sourceText = sourceText;
        this.leadingText = leadingText;
    }

    public abstract void accept(LibertyNodeVisitor visitor);

    /**
     * True when the node can be written as its original source text.
     */
    public boolean isVerbatim() {
        return sourceText != null && !modified;
    }

    /**
     * Flags this node and its enclosing groups as changed.
     */
    protected void markModified() {
        for (LibertyNode node = this; node != null && !node.modified; node = node.parent) {
            node.modified = true;
        }
    }

    /**
     * Location for diagnostics, e.g. {@code lib/cells.lib:42}.
     */
    public String getLocation() {
        if (sourceLine <= 0) {
            return sourceFile != null ? sourceFile : "<created>";
        }
        return (sourceFile != null ? sourceFile : "<input>") + ":" + sourceLine;
    }
}
