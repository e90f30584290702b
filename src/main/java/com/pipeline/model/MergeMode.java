package com.pipeline.model;

/**
 * Strategy used to reconcile the outcomes of a pipeline's steps into one value.
 */
public enum MergeMode {
    CONCAT,
    FIRST_SUCCESS,
    LAST,
    /** Merged like {@link #CONCAT}, but forces the steps to run one after another. */
    SEQUENTIAL;

    /**
     * Unknown or missing modes fall back to {@link #CONCAT}.
     */
    public static MergeMode fromValue(String value) {
        if (value == null) {
            return CONCAT;
        }
        return switch (value.trim().toLowerCase()) {
            case "first_success" -> FIRST_SUCCESS;
            case "last" -> LAST;
            case "sequential" -> SEQUENTIAL;
            default -> CONCAT;
        };
    }
}
