package com.pipeline.service.impl;

import com.pipeline.model.PipelineDefinition;
import com.pipeline.service.api.PipelineCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

@Service
@Slf4j
public class PipelineCatalogImpl implements PipelineCatalog {

    private final Map<String, PipelineDefinition> definitions = new ConcurrentSkipListMap<>();

    @Override
    public void register(PipelineDefinition definition) {
        if (definitions.put(definition.name(), definition) != null) {
            log.info("Replaced pipeline '{}'", definition.name());
        } else {
            log.info("Registered pipeline '{}'", definition.name());
        }
    }

    @Override
    public Optional<PipelineDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(definitions.get(name));
    }

    @Override
    public Collection<PipelineDefinition> list() {
        return List.copyOf(definitions.values());
    }
}
