package com.pipeline.model;

import lombok.Data;

/**
 * A named backend service as configured under {@code pipeline.services.<name>}.
 */
@Data
public class ServiceConfig {

    private String baseUrl = "";

    private AuthConfig auth = new AuthConfig();

    /**
     * Per-attempt timeout in seconds; {@code null} uses the pipeline default.
     */
    private Integer timeout;

    private ResponseFormat responseFormat = ResponseFormat.JSON;

    /**
     * Retry policy for every call to this service; {@code null} means a single attempt.
     */
    private RetryPolicy retry;
}
