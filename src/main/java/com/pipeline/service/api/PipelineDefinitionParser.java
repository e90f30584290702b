package com.pipeline.service.api;

import com.pipeline.exception.PipelineConfigurationException;
import com.pipeline.model.PipelineDefinition;

import java.io.File;

/**
 * Reads pipeline definition documents (YAML or JSON).
 */
public interface PipelineDefinitionParser {

    /**
     * Parses a definition file. The file name without extension names the pipeline when the
     * document has no {@code name}.
     *
     * @throws PipelineConfigurationException if the file cannot be read or is not a valid definition
     */
    PipelineDefinition parse(File file);

    /**
     * Parses definition text.
     *
     * @param content      YAML or JSON text
     * @param fallbackName name used when the document has none
     * @throws PipelineConfigurationException if the content is not a valid definition
     */
    PipelineDefinition parse(String content, String fallbackName);
}
