package com.pipeline.service.api;

import com.pipeline.model.AuthConfig;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the credentials a service's auth descriptor refers to.
 */
public interface AuthResolver {

    /**
     * Checks that every secret the descriptor needs is available.
     *
     * @param serviceName the service the descriptor belongs to
     * @param auth        the auth descriptor
     * @return a message naming the missing secret, or empty when the service can be called
     */
    Optional<String> validate(String serviceName, AuthConfig auth);

    /**
     * @return the headers to send for the descriptor, empty for query-parameter or no auth
     */
    Map<String, String> headers(String serviceName, AuthConfig auth);

    /**
     * @return the query parameters to send for the descriptor, empty unless it is query-parameter auth
     */
    Map<String, String> queryParams(String serviceName, AuthConfig auth);

    /**
     * @param name an environment variable or property name
     * @return its value, or "" when it is not set
     */
    String secret(String name);
}
