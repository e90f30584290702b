package com.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipeline.model.transform.TransformConfig;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A single call to a named backend service within a pipeline.
 * <p>
 * Steps are decoded from configuration before a run starts and are never modified while the
 * pipeline executes, so one instance can be shared by concurrent workers.
 */
@Value
@Builder
public class PipelineStep {

    /**
     * Unique within its pipeline. Other steps refer to this step's output as {@code {id.field}}.
     */
    String id;

    /**
     * Name of the service in the service registry.
     */
    String service;

    /**
     * Overrides the service's base URL when set.
     */
    String baseUrl;

    /**
     * Path appended to the base URL; {@code {key}} placeholders are filled from the caller input.
     */
    @Builder.Default
    String endpoint = "";

    @Builder.Default
    String method = "GET";

    /**
     * Caller input key to query parameter name. The value {@code _spread} copies every entry of a
     * map-valued input into the parameters.
     */
    @Singular("paramMapping")
    Map<String, String> paramMap;

    /**
     * Query parameters sent on every call.
     */
    ObjectNode defaultParams;

    /**
     * Fallback values for caller input keys that were not supplied.
     */
    ObjectNode defaults;

    @Singular
    Map<String, String> headers;

    JsonBodyTemplate jsonBody;

    @Singular("formField")
    Map<String, FormValue> formBody;

    /**
     * Overrides the service's response format when set.
     */
    ResponseFormat responseType;

    /**
     * The decoded {@code response} block, or {@code null} to return the raw response.
     */
    TransformConfig response;

    @Builder.Default
    OnError onError = OnError.STOP;

    /**
     * Per-attempt timeout override in seconds.
     */
    Integer timeout;

    RetryPolicy retry;

    /**
     * The step exactly as it was configured. Scanned for cross-step references before a run.
     */
    JsonNode definition;
}
