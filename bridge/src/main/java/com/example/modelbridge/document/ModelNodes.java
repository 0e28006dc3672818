package com.example.modelbridge.document;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.Locale;

/**
 * Small read helpers over loosely typed model nodes. Model attributes are strings,
 * including boolean-like flags ({@code "true"} / {@code "false"}).
 */
public final class ModelNodes {

    private ModelNodes() {
    }

    /** Returns the string value of {@code field}, or {@code ""} when absent or not a string. */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return "";
        }
        JsonNode value = node.get(field);
        return value != null && value.isString() ? value.stringValue() : "";
    }

    public static boolean isTrue(JsonNode node, String field) {
        return ModelKeys.TRUE.equals(text(node, field));
    }

    public static String name(ObjectNode node) {
        return text(node, ModelKeys.NAME);
    }

    /** Lower-cases and strips whitespace, the form used for loose name comparison. */
    public static String normalize(String name) {
        return name == null ? "" : name.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    public static boolean sameNameIgnoreCase(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }

    /** Splits a PascalCase name into words: {@code "CustomerAdmin"} becomes {@code "Customer Admin"}. */
    public static String displayText(String name) {
        if (name == null) {
            return "";
        }
        return name.replaceAll("([a-z0-9])([A-Z])", "$1 $2").replaceAll("([A-Z]+)([A-Z][a-z])", "$1 $2").trim();
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
