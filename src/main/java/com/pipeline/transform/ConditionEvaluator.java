package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.model.transform.FilterCondition;

import java.util.List;

/**
 * Evaluates {@link FilterCondition}s against records. Type mismatches make a comparison false
 * rather than raising.
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    /**
     * Keeps the elements of {@code records} that satisfy every condition.
     */
    public static List<JsonNode> filter(List<JsonNode> records, List<FilterCondition> conditions) {
        return records.stream()
                .filter(record -> conditions.stream().allMatch(condition -> matches(record, condition)))
                .toList();
    }

    public static boolean matches(JsonNode record, FilterCondition condition) {
        if (condition.field() == null || condition.field().isEmpty() || condition.operator() == null) {
            return true;
        }
        JsonNode value = record != null && record.isObject() ? record.get(condition.field()) : null;
        value = JsonValues.orNull(value);
        JsonNode operand = JsonValues.orNull(condition.operand());

        return switch (condition.operator()) {
            case EQ -> JsonValues.valuesEqual(value, operand);
            case NE -> !JsonValues.valuesEqual(value, operand);
            case GT -> JsonValues.compare(value, operand).map(c -> c > 0).orElse(false);
            case GTE -> JsonValues.compare(value, operand).map(c -> c >= 0).orElse(false);
            case LT -> JsonValues.compare(value, operand).map(c -> c < 0).orElse(false);
            case LTE -> JsonValues.compare(value, operand).map(c -> c <= 0).orElse(false);
            case CONTAINS -> containsText(value, operand);
            case NOT_CONTAINS -> !containsText(value, operand);
            case IN -> isMember(value, operand);
            case NOT_IN -> !isMember(value, operand);
        };
    }

    private static boolean containsText(JsonNode value, JsonNode operand) {
        return value.isTextual() && value.textValue().contains(JsonValues.asText(operand));
    }

    private static boolean isMember(JsonNode value, JsonNode operand) {
        if (operand.isArray()) {
            for (JsonNode candidate : operand) {
                if (JsonValues.valuesEqual(value, candidate)) {
                    return true;
                }
            }
            return false;
        }
        if (operand.isTextual()) {
            return value.isTextual() && operand.textValue().contains(value.textValue());
        }
        return false;
    }
}
