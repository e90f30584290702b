package com.pipeline.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipeline.model.MergeConfig;
import com.pipeline.model.OnError;
import com.pipeline.model.StepOutcome;
import com.pipeline.model.transform.WrapSpec;
import com.pipeline.transform.JsonValues;
import com.pipeline.transform.WrapBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reconciles the outcomes of a pipeline run into the value returned to the caller.
 * <p>
 * Outcomes are consumed in the order they were collected. For a parallel run that is completion
 * order, so {@code concat} and {@code first_success} can differ between runs unless the pipeline
 * asks for declared order.
 */
@Component
@Slf4j
public class MergeEngine {

    static final String ALL_FAILED = "All pipeline steps failed.";
    static final String NO_RESULTS = "Pipeline produced no results.";

    private static final List<String> LIST_KEYS = List.of("data", "items", "results", "restaurants", "combined");

    public JsonNode merge(List<StepOutcome> outcomes, MergeConfig config, JsonNode input) {
        return switch (config.mode()) {
            case FIRST_SUCCESS -> firstSuccess(outcomes, config, input);
            case LAST -> last(outcomes);
            case CONCAT, SEQUENTIAL -> concat(outcomes, config, input);
        };
    }

    private JsonNode concat(List<StepOutcome> outcomes, MergeConfig config, JsonNode input) {
        ArrayNode combined = JsonNodeFactory.instance.arrayNode();
        for (StepOutcome outcome : outcomes) {
            if (!outcome.success()) {
                if (outcome.onError() == OnError.STOP) {
                    log.warn("Step '{}' failed and is required; returning its error", outcome.stepId());
                    return outcome.data();
                }
                log.debug("Skipping failed step '{}'", outcome.stepId());
                continue;
            }
            for (JsonNode item : listView(outcome.data())) {
                if (config.sourceTag() && item.isObject() && !item.has("source")) {
                    ObjectNode tagged = ((ObjectNode) item).deepCopy();
                    tagged.put("source", outcome.stepId());
                    combined.add(tagged);
                } else {
                    combined.add(item);
                }
            }
        }
        if (config.wrap().isPresent()) {
            return wrap(config.wrap().get(), combined, combined.size(), input);
        }
        return combined;
    }

    private JsonNode firstSuccess(List<StepOutcome> outcomes, MergeConfig config, JsonNode input) {
        for (StepOutcome outcome : outcomes) {
            if (!outcome.success()) {
                continue;
            }
            if (config.wrap().isEmpty()) {
                return outcome.data();
            }
            ArrayNode items = listView(outcome.data());
            JsonNode results = items.isEmpty() ? outcome.data() : items;
            return wrap(config.wrap().get(), results, items.size(), input);
        }
        ObjectNode details = JsonNodeFactory.instance.objectNode();
        outcomes.forEach(outcome -> details.set(outcome.stepId(), outcome.data()));
        ObjectNode error = JsonValues.error(ALL_FAILED);
        error.set("details", details);
        return error;
    }

    private JsonNode last(List<StepOutcome> outcomes) {
        JsonNode last = null;
        for (StepOutcome outcome : outcomes) {
            if (outcome.success()) {
                last = outcome.data();
            }
        }
        return last != null ? last : JsonValues.error(NO_RESULTS);
    }

    private static JsonNode wrap(WrapSpec spec, JsonNode results, int count, JsonNode input) {
        // a merge has no single raw response, so from_root entries resolve to 0
        return WrapBuilder.build(spec, results, count, null, input);
    }

    /**
     * The list a step contributes: a list as-is, the first list under a well-known key of an
     * object, or the object itself as a singleton. Anything else contributes nothing.
     */
    static ArrayNode listView(JsonNode data) {
        ArrayNode items = JsonNodeFactory.instance.arrayNode();
        if (data.isArray()) {
            items.addAll((ArrayNode) data);
        } else if (data.isObject()) {
            for (String key : LIST_KEYS) {
                JsonNode value = data.get(key);
                if (value != null && value.isArray()) {
                    items.addAll((ArrayNode) value);
                    return items;
                }
            }
            items.add(data);
        }
        return items;
    }
}
