package com.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * A fully resolved HTTP request, ready for the transport.
 *
 * @param method         HTTP method name
 * @param url            base URL plus endpoint, without the query string
 * @param headers        request headers
 * @param params         query parameters; array values repeat the parameter, {@code null} values are skipped
 * @param jsonBody       JSON body, or {@code null}
 * @param formBody       URL-encoded form body, or {@code null}
 * @param timeoutSeconds per-attempt timeout
 * @param format         how to parse the response body
 * @param retry          retry policy, or {@code null} for a single attempt
 */
public record HttpCall(
        String method,
        String url,
        Map<String, String> headers,
        ObjectNode params,
        JsonNode jsonBody,
        Map<String, String> formBody,
        int timeoutSeconds,
        ResponseFormat format,
        RetryPolicy retry) {
}
