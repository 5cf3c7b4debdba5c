package com.di.importgate.stage.review;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented reader for MCF and template MCF. Each {@code key: value} line belongs
 * to the most recent {@code Node:}; text after {@code #} is a comment.
 */
public final class McfParser {

    /** {@code C:table->column}; the column id runs to the end of the value. */
    private static final Pattern COLUMN_REF = Pattern.compile("C:[^>]+->(.+)");

    private McfParser() {
    }

    public static List<McfNode> parse(String content) {
        List<McfNode> nodes = new ArrayList<>();
        String nodeId = null;
        int nodeLine = 0;
        List<McfNode.Property> props = new ArrayList<>();

        String[] lines = content.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = stripComment(lines[i]).strip();
            if (line.isEmpty()) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).strip();
            String value = unquote(line.substring(colon + 1).strip());
            if (key.equals("Node")) {
                if (nodeId != null) {
                    nodes.add(new McfNode(nodeId, nodeLine, List.copyOf(props)));
                }
                nodeId = value;
                nodeLine = i + 1;
                props = new ArrayList<>();
            } else if (nodeId != null) {
                props.add(new McfNode.Property(key, value, i + 1));
            }
        }
        if (nodeId != null) {
            nodes.add(new McfNode(nodeId, nodeLine, List.copyOf(props)));
        }
        return nodes;
    }

    /** Column id of a {@code C:table->column} value, or null when the value is not a column reference. */
    public static String columnOf(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = COLUMN_REF.matcher(value.strip());
        return m.matches() ? m.group(1).strip() : null;
    }

    /** Column ids referenced anywhere in the nodes, in order of first appearance. */
    public static Set<String> columnReferences(List<McfNode> nodes) {
        Set<String> refs = new LinkedHashSet<>();
        for (McfNode node : nodes) {
            for (McfNode.Property p : node.properties()) {
                String column = columnOf(p.value());
                if (column != null && !column.isEmpty()) {
                    refs.add(column);
                }
            }
        }
        return refs;
    }

    public static boolean hasNamespace(String value) {
        return value != null && value.matches("^[A-Za-z][A-Za-z0-9]*:.+");
    }

    /** Drops a leading {@code dcs:}, {@code dcid:} or {@code schema:} style prefix. */
    public static String stripNamespace(String value) {
        if (value == null) {
            return "";
        }
        String v = value.strip();
        return hasNamespace(v) ? v.substring(v.indexOf(':') + 1).strip() : v;
    }

    private static String stripComment(String line) {
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '#' && !quoted) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"").strip();
        }
        return value;
    }
}
