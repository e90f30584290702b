package com.pipeline.model.transform;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One predicate of the {@code filter} stage, e.g. {@code {field: score, gte: 50}}.
 *
 * @param field    record field to test; an empty field matches every record
 * @param operator the operator, or {@code null} when none was declared (matches every record)
 * @param operand  the right-hand side of the comparison
 */
public record FilterCondition(String field, FilterOperator operator, JsonNode operand) {
}
