package com.pipeline.model.transform;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A step's {@code response} block decoded into its seven optional stages. The stages always run
 * in declaration order of this record: extract, first, fields, filter, sort, limit, wrap.
 */
public record TransformConfig(
        Optional<ExtractPath> extract,
        boolean first,
        Optional<Map<String, FieldSpec>> fields,
        Optional<List<FilterCondition>> filter,
        Optional<SortSpec> sort,
        OptionalInt limit,
        Optional<WrapSpec> wrap) {

    public static final TransformConfig EMPTY = new TransformConfig(
            Optional.empty(), false, Optional.empty(), Optional.empty(),
            Optional.empty(), OptionalInt.empty(), Optional.empty());
}
