package com.pipeline.model.transform;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The value source for one key of a {@link WrapSpec}.
 */
public interface WrapValue {

    /** A constant copied into the output. */
    record Literal(JsonNode value) implements WrapValue {
    }

    /** {@code _results}: the computed collection or value. */
    record Results() implements WrapValue {
    }

    /** {@code _count}: the size of the computed collection. */
    record Count() implements WrapValue {
    }

    /** {@code {from_root: path}}: a lookup against the untransformed response. */
    record FromRoot(String path) implements WrapValue {
    }

    /** {@code {template: "..."}}: rendered against the caller input plus {@code _count}. */
    record Template(String template) implements WrapValue {
    }

    /** {@code {from_input: key}}: a value from the caller input. */
    record FromInput(String key) implements WrapValue {
    }
}
