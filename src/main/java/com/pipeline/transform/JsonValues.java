package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Small helpers for treating loosely-typed {@link JsonNode} values the way configuration authors
 * expect: null-safe text rendering, truthiness and numeric-aware comparison.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Normalizes a possibly-absent node to {@link NullNode}.
     */
    public static JsonNode orNull(JsonNode node) {
        return node == null || node.isMissingNode() ? NullNode.getInstance() : node;
    }

    public static boolean isNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Renders a node as plain text. Scalars render their value, containers render as JSON and
     * null renders as the empty string.
     */
    public static String asText(JsonNode node) {
        if (isNull(node)) {
            return "";
        }
        if (node.isContainerNode()) {
            return node.toString();
        }
        return node.asText();
    }

    /**
     * Truthiness of a value: null, false, zero, empty text and empty containers are false.
     */
    public static boolean isTruthy(JsonNode node) {
        if (isNull(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.decimalValue().signum() != 0;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }

    /**
     * Equality with numeric widening, so {@code 1} equals {@code 1.0}.
     */
    public static boolean valuesEqual(JsonNode left, JsonNode right) {
        JsonNode a = orNull(left);
        JsonNode b = orNull(right);
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    /**
     * Orders two values when they are mutually comparable: number with number, text with text,
     * boolean with boolean. Any other pairing has no ordering.
     */
    public static Optional<Integer> compare(JsonNode left, JsonNode right) {
        JsonNode a = orNull(left);
        JsonNode b = orNull(right);
        if (a.isNumber() && b.isNumber()) {
            return Optional.of(a.decimalValue().compareTo(b.decimalValue()));
        }
        if (a.isTextual() && b.isTextual()) {
            return Optional.of(a.textValue().compareTo(b.textValue()));
        }
        if (a.isBoolean() && b.isBoolean()) {
            return Optional.of(Boolean.compare(a.booleanValue(), b.booleanValue()));
        }
        return Optional.empty();
    }

    /**
     * Best-effort numeric reading: numbers as-is, booleans as 1/0, numeric text parsed.
     */
    public static Optional<BigDecimal> toNumber(JsonNode node) {
        if (isNull(node)) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.decimalValue());
        }
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue() ? BigDecimal.ONE : BigDecimal.ZERO);
        }
        if (node.isTextual()) {
            try {
                return Optional.of(new BigDecimal(node.textValue().strip()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static ObjectNode error(String message) {
        return JsonNodeFactory.instance.objectNode().put("error", message);
    }

    /**
     * A result is an error when it is an object carrying an {@code error} key.
     */
    public static boolean isError(JsonNode node) {
        return node != null && node.isObject() && node.has("error");
    }
}
