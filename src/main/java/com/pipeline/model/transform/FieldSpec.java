package com.pipeline.model.transform;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * How one output field of the {@code fields} stage is derived. Decoded once from configuration;
 * the mapper only ever switches over these variants.
 */
public interface FieldSpec {

    /**
     * A literal value, written as {@code {value: ...}} or as any non-text, non-object config.
     */
    record Constant(JsonNode value) implements FieldSpec {
    }

    /**
     * A {@code {template: "{a} > {b}"}} filled against the source record.
     */
    record Template(String template) implements FieldSpec {
    }

    /**
     * A bare string naming the source field directly.
     */
    record Shorthand(String field) implements FieldSpec {
    }

    /**
     * {@code {from: path, default: ..., <coercions>}}.
     *
     * @param from         source field, a dot path when it contains {@code .}; may be {@code null}
     * @param defaultValue used when the source resolves to null; may be {@code null}
     * @param coercions    coercions applied after defaulting
     */
    record Source(String from, JsonNode defaultValue, FieldCoercions coercions) implements FieldSpec {
    }
}
