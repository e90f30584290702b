package com.pipeline.model.transform;

/**
 * Comparison operators of a filter condition, listed in the precedence used when a condition
 * declares more than one.
 */
public enum FilterOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    IN("in"),
    NOT_IN("not_in");

    private final String key;

    FilterOperator(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
