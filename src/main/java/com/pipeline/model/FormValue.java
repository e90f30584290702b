package com.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a step's {@code form_body}.
 */
public interface FormValue {

    record Literal(JsonNode value) implements FormValue {
    }

    /** {@code {env: NAME}}: the value of an environment variable or property. */
    record Env(String name) implements FormValue {
    }

    /** {@code {from_input: key}}: a value from the caller input. */
    record FromInput(String key) implements FormValue {
    }
}
