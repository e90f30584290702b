package com.pipeline.model.transform;

/**
 * {@code sort: {by: price, order: desc, type: number}}.
 */
public record SortSpec(String by, boolean descending, boolean numeric) {
}
