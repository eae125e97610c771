package com.charlib.tool.tree.node;

/**
 * Visitor over the in-memory Liberty tree.
 */
public interface LibertyNodeVisitor {
    void visit(GroupNode group);

    void visit(AttributeNode attribute);
}
