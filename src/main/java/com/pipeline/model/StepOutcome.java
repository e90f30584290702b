package com.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.transform.JsonValues;

/**
 * The result of running one step once.
 *
 * @param stepId  id of the step that produced it
 * @param index   declared position of the step in its pipeline
 * @param data    the step's (possibly transformed) result, or an {@code {"error": ...}} object
 * @param success whether {@code data} is free of an {@code error} key
 * @param onError the step's failure policy
 */
public record StepOutcome(String stepId, int index, JsonNode data, boolean success, OnError onError) {

    public static StepOutcome of(PipelineStep step, int index, JsonNode data) {
        JsonNode value = JsonValues.orNull(data);
        return new StepOutcome(step.getId(), index, value, !JsonValues.isError(value), step.getOnError());
    }
}
