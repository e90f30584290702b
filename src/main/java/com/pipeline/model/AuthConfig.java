package com.pipeline.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The auth descriptor of a service. Secrets are referenced by name and resolved at call time.
 */
@Data
public class AuthConfig {

    private AuthType type = AuthType.NONE;

    /**
     * Name of the environment variable (or property) holding the credential.
     */
    private String envVar;

    /**
     * Query parameter name for {@link AuthType#QUERY_PARAM}.
     */
    private String keyName = "apiKey";

    /**
     * Look the credential up in the credential store when the environment does not have it.
     */
    private boolean configFallback;

    private String headerName;

    /**
     * Prepended to the header value, e.g. {@code "Bearer "} or {@code "KakaoAK "}.
     */
    private String prefix = "";

    /**
     * A fixed header value that needs no secret lookup.
     */
    private String staticValue;

    /**
     * Header name to secret name, for {@link AuthType#HEADER_PAIR}.
     */
    private Map<String, String> headers = new LinkedHashMap<>();
}
