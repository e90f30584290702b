package com.pipeline.service.api;

import com.pipeline.model.PipelineDefinition;

import java.util.Collection;
import java.util.Optional;

/**
 * In-memory registry of named pipeline definitions.
 */
public interface PipelineCatalog {

    /**
     * Adds a definition, replacing any earlier one with the same name.
     */
    void register(PipelineDefinition definition);

    Optional<PipelineDefinition> find(String name);

    /**
     * @return all definitions ordered by name
     */
    Collection<PipelineDefinition> list();
}
