package com.pipeline.service.api;

import com.pipeline.model.ServiceConfig;

import java.util.Map;
import java.util.Optional;

/**
 * Looks up the backend services that pipeline steps call by name.
 */
public interface ServiceRegistry {

    Optional<ServiceConfig> find(String name);

    /**
     * @return every configured service, keyed by name
     */
    Map<String, ServiceConfig> all();
}
