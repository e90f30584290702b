package com.pipeline.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.model.PipelineStep;

import java.util.Map;

public interface StepExecutor {

    /**
     * Builds and sends the request of one step and applies its response transform.
     *
     * @param step        the step to run
     * @param input       the caller's input as a JSON object
     * @param stepOutputs results of the steps that already succeeded, keyed by step id
     * @return the step's result, or an {@code {"error": ...}} object
     */
    JsonNode execute(PipelineStep step, JsonNode input, Map<String, JsonNode> stepOutputs);
}
