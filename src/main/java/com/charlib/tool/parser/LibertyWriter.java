package com.charlib.tool.parser;

import java.util.List;
import java.util.regex.Pattern;

import com.charlib.tool.tree.AttributeType;
import com.charlib.tool.tree.AttributeValue;
import com.charlib.tool.tree.node.AttributeNode;
import com.charlib.tool.tree.node.GroupNode;
import com.charlib.tool.tree.node.LibertyNode;
import com.charlib.tool.tree.node.LibertyNodeVisitor;

/**
 * Serializes an in-memory Liberty tree back to text.
 *
 * Parsed nodes that were never modified are written as their original source text, along
 * with the comments and whitespace around them. A modified group keeps its own header,
 * footer and the text between its children; only the modified attributes and nodes created
 * after parsing are generated. Generated text uses two-space indentation and breaks complex
 * attributes with several quoted values (LUT rows) over continuation lines aligned with the
 * first value.
 */
public class LibertyWriter implements LibertyNodeVisitor {

    private static final String INDENT = "  ";
    private static final Pattern BARE_NAME = Pattern.compile("[A-Za-z0-9_.\\-\\[\\]!]+");

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    public static String write(GroupNode root) {
        LibertyWriter writer = new LibertyWriter();
        if (root.getLeadingText() != null) {
            writer.out.append(root.getLeadingText());
        }
        root.accept(writer);
        writer.out.append('\n');
        return writer.out.toString();
    }

    @Override
    public void visit(GroupNode group) {
        if (group.isVerbatim()) {
            out.append(group.getSourceText());
            return;
        }

        if (group.getHeaderText() != null) {
            out.append(group.getHeaderText());
        } else {
            writeHeader(group);
        }

        depth++;
        for (LibertyNode child : group.getChildren()) {
            if (child.getLeadingText() != null) {
                out.append(child.getLeadingText());
            } else {
                newLine();
            }
            child.accept(this);
        }
        depth--;

        if (group.getFooterText() != null) {
            out.append(group.getFooterText());
        } else {
            newLine();
            out.append('}');
        }
    }

    @Override
    public void visit(AttributeNode attribute) {
        if (attribute.isVerbatim()) {
            out.append(attribute.getSourceText());
            return;
        }

        out.append(attribute.getName());

        if (attribute.getType() == AttributeType.SIMPLE) {
            out.append(" : ").append(formatValue(attribute.getScalar())).append(" ;");
            return;
        }

        List<AttributeValue> values = attribute.getValues();
        boolean multiLine = values.stream().filter(AttributeValue::isQuoted).count() > 1;
        String alignment = " ".repeat(attribute.getName().length() + 2);
        out.append(" (");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.append(",");
                if (multiLine) {
                    out.append(" \\");
                    newLine();
                    out.append(alignment);
                } else {
                    out.append(" ");
                }
            }
            out.append(formatValue(values.get(i)));
        }
        out.append(") ;");
    }

    private void writeHeader(GroupNode group) {
        out.append(group.getGroupType()).append(" (");
        List<String> names = group.getNames();
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(formatName(names.get(i)));
        }
        out.append(") {");
    }

    private static String formatValue(AttributeValue value) {
        if (value.isQuoted()) {
            return "\"" + value.text().replace("\"", "\\\"") + "\"";
        }
        return value.text();
    }

    private static String formatName(String name) {
        if (BARE_NAME.matcher(name).matches()) {
            return name;
        }
        return "\"" + name.replace("\"", "\\\"") + "\"";
    }

    private void newLine() {
        out.append('\n');
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
    }
}
