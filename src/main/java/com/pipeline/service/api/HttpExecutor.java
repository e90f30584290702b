package com.pipeline.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.model.HttpCall;

/**
 * The HTTP transport used by pipeline steps. Owns retries, timeouts and response parsing.
 */
public interface HttpExecutor {

    /**
     * @param call the request to send
     * @return the parsed response body, or an {@code {"error": ...}} object for any HTTP or
     *         transport failure; never throws for those
     */
    JsonNode execute(HttpCall call);
}
