package com.pipeline.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipeline.exception.PipelineConfigurationException;
import com.pipeline.model.FormValue;
import com.pipeline.model.JsonBodyTemplate;
import com.pipeline.model.MergeConfig;
import com.pipeline.model.MergeMode;
import com.pipeline.model.OnError;
import com.pipeline.model.PipelineStep;
import com.pipeline.model.ResponseFormat;
import com.pipeline.model.RetryPolicy;
import com.pipeline.transform.JsonValues;
import com.pipeline.transform.TransformConfigDecoder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes the {@code pipeline} and {@code merge} blocks of a definition into typed steps.
 */
public final class PipelineConfigDecoder {

    static final String EMPTY_PIPELINE = "Pipeline configuration is empty.";

    private PipelineConfigDecoder() {
    }

    /**
     * @param pipeline the configured step list
     * @return the decoded steps in declared order
     * @throws PipelineConfigurationException if the list is missing, empty or holds an invalid step
     */
    public static List<PipelineStep> decodeSteps(JsonNode pipeline) {
        if (pipeline == null || !pipeline.isArray() || pipeline.size() == 0) {
            throw new PipelineConfigurationException(EMPTY_PIPELINE);
        }
        List<PipelineStep> steps = new ArrayList<>(pipeline.size());
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < pipeline.size(); i++) {
            PipelineStep step = decodeStep(pipeline.get(i), i);
            if (!ids.add(step.getId())) {
                throw new PipelineConfigurationException("Duplicate step id: " + step.getId());
            }
            steps.add(step);
        }
        return steps;
    }

    public static PipelineStep decodeStep(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new PipelineConfigurationException("Pipeline step " + index + " must be a mapping");
        }
        PipelineStep.PipelineStepBuilder builder = PipelineStep.builder()
                .id(node.hasNonNull("id") ? JsonValues.asText(node.get("id")) : "step_" + index)
                .service(node.hasNonNull("service") ? JsonValues.asText(node.get("service")) : null)
                .baseUrl(node.hasNonNull("base_url") ? JsonValues.asText(node.get("base_url")) : null)
                .endpoint(JsonValues.asText(node.get("endpoint")))
                .method(node.hasNonNull("method") ? JsonValues.asText(node.get("method")).toUpperCase() : "GET")
                .paramMap(textMap(node.get("param_map")))
                .defaultParams(objectCopy(node.get("default_params")))
                .defaults(objectCopy(node.get("defaults")))
                .headers(textMap(node.get("headers")))
                .jsonBody(decodeJsonBody(node.get("json_body")))
                .formBody(decodeFormBody(node.get("form_body")))
                .onError(OnError.fromValue(node.path("on_error").asText("stop")))
                .definition(node);

        JsonNode responseType = node.get("response_type");
        if (responseType != null && responseType.isTextual()) {
            builder.responseType(ResponseFormat.fromValue(responseType.textValue()));
        }
        JsonNode response = node.get("response");
        if (JsonValues.isTruthy(response)) {
            builder.response(TransformConfigDecoder.decode(response));
        }
        JsonNode timeout = node.get("timeout");
        if (timeout != null && timeout.isNumber() && timeout.intValue() > 0) {
            builder.timeout(timeout.intValue());
        }
        if (JsonValues.isTruthy(node.get("retry"))) {
            builder.retry(decodeRetry(node.get("retry")));
        }
        return builder.build();
    }

    /**
     * @param merge the configured merge block, may be {@code null}
     * @return the decoded block; unknown modes merge like {@code concat}
     */
    public static MergeConfig decodeMerge(JsonNode merge) {
        if (merge == null || !merge.isObject()) {
            return MergeConfig.DEFAULT;
        }
        return new MergeConfig(
                MergeMode.fromValue(merge.path("mode").asText("concat")),
                JsonValues.isTruthy(merge.get("source_tag")),
                TransformConfigDecoder.decodeWrap(merge.get("wrap")),
                JsonValues.isTruthy(merge.get("preserve_declared_order")));
    }

    public static RetryPolicy decodeRetry(JsonNode node) {
        RetryPolicy policy = new RetryPolicy();
        if (node == null || !node.isObject()) {
            return policy;
        }
        if (node.path("max_attempts").canConvertToInt()) {
            policy.setMaxAttempts(node.get("max_attempts").intValue());
        }
        if (node.hasNonNull("backoff")) {
            policy.setBackoff(node.get("backoff").asText());
        }
        if (node.path("delay").isNumber()) {
            policy.setDelay(node.get("delay").doubleValue());
        }
        JsonNode retryOn = node.get("retry_on");
        if (retryOn != null && retryOn.isArray()) {
            List<Integer> codes = new ArrayList<>();
            retryOn.forEach(code -> {
                if (code.canConvertToInt()) {
                    codes.add(code.intValue());
                }
            });
            policy.setRetryOn(codes);
        }
        return policy;
    }

    private static JsonBodyTemplate decodeJsonBody(JsonNode node) {
        if (!JsonValues.isTruthy(node)) {
            return null;
        }
        if (!node.isObject()) {
            return new JsonBodyTemplate(null, Map.of(), node);
        }
        return new JsonBodyTemplate(objectCopy(node.get("defaults")), textMap(node.get("param_map")), null);
    }

    private static Map<String, FormValue> decodeFormBody(JsonNode node) {
        Map<String, FormValue> form = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return form;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isObject() && value.has("env")) {
                form.put(field.getKey(), new FormValue.Env(JsonValues.asText(value.get("env"))));
            } else if (value.isObject() && value.has("from_input")) {
                form.put(field.getKey(), new FormValue.FromInput(JsonValues.asText(value.get("from_input"))));
            } else {
                form.put(field.getKey(), new FormValue.Literal(value));
            }
        }
        return form;
    }

    private static Map<String, String> textMap(JsonNode node) {
        Map<String, String> map = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return map;
        }
        node.fields().forEachRemaining(field -> map.put(field.getKey(), JsonValues.asText(field.getValue())));
        return map;
    }

    private static ObjectNode objectCopy(JsonNode node) {
        return node != null && node.isObject()
                ? ((ObjectNode) node).deepCopy()
                : JsonNodeFactory.instance.objectNode();
    }
}
