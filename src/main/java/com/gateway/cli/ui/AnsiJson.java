package com.gateway.cli.ui;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Renders JSON trees as indented text with ANSI colors: keys cyan, strings green, numbers
 * yellow, booleans purple and nulls red.
 */
public final class AnsiJson {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_WHITE = "\u001B[37m";

    private AnsiJson() {
    }

    public static String format(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return ANSI_PURPLE + "null" + ANSI_RESET;
        }
        StringBuilder sb = new StringBuilder();
        append(node, sb, 0);
        return sb.toString();
    }

    private static void append(JsonNode node, StringBuilder sb, int indentLevel) {
        String indent = "  ".repeat(indentLevel);
        if (node.isObject()) {
            sb.append(ANSI_WHITE).append("{").append(ANSI_RESET).append("\n");
            Iterator<Map.Entry<String, JsonNode>> fields = node.properties().iterator();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sb.append(indent).append("  ").append(ANSI_CYAN).append("\"").append(field.getKey()).append("\"").append(ANSI_RESET).append(": ");
                append(field.getValue(), sb, indentLevel + 1);
                if (fields.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(ANSI_WHITE).append("}").append(ANSI_RESET);
        } else if (node.isArray()) {
            sb.append(ANSI_WHITE).append("[").append(ANSI_RESET).append("\n");
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                sb.append(indent).append("  ");
                append(elements.next(), sb, indentLevel + 1);
                if (elements.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(ANSI_WHITE).append("]").append(ANSI_RESET);
        } else if (node.isTextual()) {
            sb.append(ANSI_GREEN).append("\"").append(node.asText()).append("\"").append(ANSI_RESET);
        } else if (node.isNumber()) {
            sb.append(ANSI_YELLOW).append(node.asText()).append(ANSI_RESET);
        } else if (node.isBoolean()) {
            sb.append(ANSI_PURPLE).append(node.asBoolean()).append(ANSI_RESET);
        } else if (node.isNull()) {
            sb.append(ANSI_RED).append("null").append(ANSI_RESET);
        } else {
            sb.append(node.asText());
        }
    }
}
