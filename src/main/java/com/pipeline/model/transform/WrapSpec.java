package com.pipeline.model.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative description of an output envelope, e.g.
 * {@code {success: true, count: _count, data: _results}}. Key order is preserved.
 */
public record WrapSpec(Map<String, WrapValue> entries) {

    public WrapSpec {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
