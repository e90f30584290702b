package com.pipeline.service.impl;

import com.pipeline.config.PipelineProperties;
import com.pipeline.model.ServiceConfig;
import com.pipeline.service.api.ServiceRegistry;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Serves the services declared under {@code pipeline.services} in the application configuration.
 */
@Service
public class ConfigurationServiceRegistry implements ServiceRegistry {

    private final PipelineProperties properties;

    public ConfigurationServiceRegistry(PipelineProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<ServiceConfig> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(properties.getServices().get(name));
    }

    @Override
    public Map<String, ServiceConfig> all() {
        return Collections.unmodifiableMap(properties.getServices());
    }
}
