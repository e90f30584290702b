package com.pipeline.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pipeline.exception.PipelineConfigurationException;
import com.pipeline.model.PipelineDefinition;
import com.pipeline.service.api.PipelineDefinitionParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Parses definition documents with a Jackson YAML mapper; YAML being a superset of JSON, the same
 * mapper reads {@code .json} files.
 * <p>
 * Expected shape:
 * <pre>
 * name: search_restaurants
 * description: Kakao and Naver local search, merged
 * pipeline:
 *   - id: kakao
 *     service: kakao
 *     ...
 * merge:
 *   mode: concat
 *   source_tag: true
 * </pre>
 */
@Service
@Slf4j
public class PipelineDefinitionParserImpl implements PipelineDefinitionParser {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    @Override
    public PipelineDefinition parse(File file) {
        String content;
        try {
            content = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Could not read pipeline definition " + file.getPath(), e);
        }
        return parse(content, baseName(file.getName()));
    }

    @Override
    public PipelineDefinition parse(String content, String fallbackName) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new PipelineConfigurationException("Malformed pipeline definition: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PipelineConfigurationException("A pipeline definition must be a mapping");
        }
        String name = root.hasNonNull("name") ? root.get("name").asText() : fallbackName;
        if (name == null || name.isBlank()) {
            throw new PipelineConfigurationException("A pipeline definition needs a name");
        }
        PipelineDefinition definition = new PipelineDefinition(
                name,
                root.path("description").asText(""),
                PipelineConfigDecoder.decodeSteps(root.get("pipeline")),
                PipelineConfigDecoder.decodeMerge(root.get("merge")));
        log.debug("Parsed pipeline '{}' with {} step(s)", name, definition.steps().size());
        return definition;
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
