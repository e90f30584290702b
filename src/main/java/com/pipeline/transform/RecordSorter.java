package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.model.transform.SortSpec;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stable sort of records by one field. When sorting fails the records come back in their
 * original order.
 */
@Slf4j
public final class RecordSorter {

    private RecordSorter() {
    }

    public static List<JsonNode> sort(List<JsonNode> records, SortSpec spec) {
        if (spec.by() == null || spec.by().isEmpty()) {
            return records;
        }
        Comparator<JsonNode> comparator = spec.numeric()
                ? Comparator.comparing(record -> numericKey(record, spec.by()))
                : Comparator.comparing(record -> textKey(record, spec.by()));
        if (spec.descending()) {
            comparator = comparator.reversed();
        }
        List<JsonNode> sorted = new ArrayList<>(records);
        try {
            sorted.sort(comparator);
            return sorted;
        } catch (RuntimeException e) {
            log.warn("Could not sort records by '{}', keeping original order: {}", spec.by(), e.getMessage());
            return records;
        }
    }

    private static BigDecimal numericKey(JsonNode record, String field) {
        JsonNode value = record != null && record.isObject() ? record.get(field) : null;
        return JsonValues.toNumber(value).orElse(BigDecimal.ZERO);
    }

    private static String textKey(JsonNode record, String field) {
        JsonNode value = record != null && record.isObject() ? record.get(field) : null;
        return JsonValues.asText(value);
    }
}
