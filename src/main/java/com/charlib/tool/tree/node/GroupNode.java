package com.charlib.tool.tree.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.charlib.tool.exception.TreeMutationException;
import com.charlib.tool.tree.AttributeType;
import com.charlib.tool.tree.LibertyAttribute;
import com.charlib.tool.tree.LibertyGroup;

import lombok.Builder;
import lombok.Getter;

/**
 * Group node of the in-memory Liberty tree. Children keep their source order so the
 * writer can reproduce the original layout.
 *
 * A parsed group also keeps its header text, up to the opening brace, and its footer text,
 * everything after the last child up to the closing brace. A group with edited children is
 * still written with its own framing and comments.
 */
@Getter
public class GroupNode extends LibertyNode implements LibertyGroup {

    private final String groupType;
    private final List<String> names;
    private final List<LibertyNode> children;
    private final String headerText;
    private final String footerText;

    @Builder
    public GroupNode(String groupType, List<String> names, List<LibertyNode> children,
                     String sourceFile, int sourceLine, String sourceText, String leadingText,
                     String headerText, String footerText) {
        super(sourceFile, sourceLine, sourceText, leadingText);
        this.groupType = groupType;
        this.headerText = headerText;
        this.footerText = footerText;
        this.names = names != null ? List.copyOf(names) : List.of();
        this.children = new ArrayList<>();
        if (children != null) {
            children.forEach(this::addChild);
        }
    }

    public void addChild(LibertyNode child) {
        children.add(child);
        child.setParent(this);
    }

    @Override
    public void accept(LibertyNodeVisitor visitor) {
        visitor.visit(this);
    }

    public List<LibertyNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public List<LibertyGroup> getGroups() {
        List<LibertyGroup> groups = new ArrayList<>();
        for (LibertyNode child : children) {
            if (child instanceof GroupNode group) {
                groups.add(group);
            }
        }
        return groups;
    }

    public List<AttributeNode> getAttributes() {
        List<AttributeNode> attributes = new ArrayList<>();
        for (LibertyNode child : children) {
            if (child instanceof AttributeNode attribute) {
                attributes.add(attribute);
            }
        }
        return attributes;
    }

    @Override
    public Optional<LibertyAttribute> findAttribute(String name) {
        for (LibertyNode child : children) {
            if (child instanceof AttributeNode attribute && attribute.getName().equals(name)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    /**
     * New attributes go right after the last existing attribute, ahead of any nested group.
     */
    @Override
    public LibertyAttribute createAttribute(String name, AttributeType type) {
        if (name == null || name.isBlank()) {
            throw new TreeMutationException("Attribute name must not be blank in group " + describe());
        }
        if (type == AttributeType.SIMPLE && findAttribute(name).isPresent()) {
            throw new TreeMutationException("Simple attribute '" + name + "' already exists in group " + describe());
        }
        AttributeNode attribute = AttributeNode.builder()
                .name(name)
                .type(type)
                .sourceFile(sourceFile)
                .build();

        int insertAt = 0;
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof AttributeNode) {
                insertAt = i + 1;
            }
        }
        children.add(insertAt, attribute);
        attribute.setParent(this);
        markModified();
        return attribute;
    }

    @Override
    public void deleteAttribute(LibertyAttribute attribute) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == attribute) {
                children.remove(i);
                ((AttributeNode) attribute).setParent(null);
                markModified();
                return;
            }
        }
        throw new TreeMutationException("Attribute '" + attribute.getName() + "' does not belong to group " + describe());
    }

    @Override
    public LibertyGroup createGroup(String groupType, List<String> names) {
        if (groupType == null || groupType.isBlank()) {
            throw new TreeMutationException("Group type must not be blank in group " + describe());
        }
        GroupNode group = GroupNode.builder()
                .groupType(groupType)
                .names(names)
                .sourceFile(sourceFile)
                .build();
        addChild(group);
        markModified();
        return group;
    }

    public String describe() {
        return groupType + "(" + String.join(", ", names) + ")";
    }

    @Override
    public String toString() {
        return "GroupNode(" + describe() + ", children=" + children.size() + ")";
    }
}
