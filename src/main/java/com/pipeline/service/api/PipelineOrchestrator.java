package com.pipeline.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.model.MergeConfig;
import com.pipeline.model.PipelineStep;

import java.util.List;
import java.util.Map;

/**
 * Runs a pipeline of steps and reduces their outcomes to a single value.
 * <p>
 * Neither method throws for a failing step or a malformed definition; problems are reported as a
 * returned {@code {"error": ...}} object.
 */
public interface PipelineOrchestrator {

    /**
     * Executes decoded steps.
     *
     * @param steps the steps in declared order
     * @param merge how the step outcomes are reconciled
     * @param input the caller's input
     * @return the merged value
     */
    JsonNode run(List<PipelineStep> steps, MergeConfig merge, Map<String, Object> input);

    /**
     * Decodes a raw {@code pipeline} list and {@code merge} block, then executes them.
     *
     * @param pipeline the step list as configured
     * @param merge    the merge block as configured, may be {@code null}
     * @param input    the caller's input
     * @return the merged value, or an error object when the definition cannot be decoded
     */
    JsonNode run(JsonNode pipeline, JsonNode merge, Map<String, Object> input);
}
