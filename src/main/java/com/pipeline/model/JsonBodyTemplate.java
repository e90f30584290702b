package com.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * A step's {@code json_body}: either a {@code {defaults, param_map}} block assembled from the
 * caller input, or a literal body used as-is.
 *
 * @param defaults body fields present on every call
 * @param paramMap caller input key to body field
 * @param literal  a non-mapping body sent verbatim; {@code null} for the assembled form
 */
public record JsonBodyTemplate(ObjectNode defaults, Map<String, String> paramMap, JsonNode literal) {
}
