package com.pipeline.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pipeline.model.PipelineStep;
import com.pipeline.transform.JsonValues;
import com.pipeline.transform.TemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Substitutes {@code {step_id.field}} and {@code {step_id._result}} references with the output of
 * earlier steps.
 * <p>
 * A reference to a step that has not produced an output is left exactly as written.
 */
@Component
public class ReferenceResolver {

    static final String RESULT_FIELD = "_result";

    private static final Pattern REFERENCE =
            Pattern.compile("\\{(\\w+\\.\\w+)}", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern STEP_REFERENCE = Pattern.compile("\\{[A-Za-z_]\\w*\\.\\w+}");

    private final TemplateRenderer renderer =
            new TemplateRenderer(REFERENCE, TemplateRenderer.MissingKeyPolicy.KEEP_LITERAL);

    /**
     * True when any step's configuration contains a reference-shaped placeholder, in which case the
     * steps must run one after another.
     */
    public boolean hasReferences(List<PipelineStep> steps) {
        for (PipelineStep step : steps) {
            if (STEP_REFERENCE.matcher(scannableText(step)).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * The configured text of a step. Steps built in code carry no raw definition, so their typed
     * fields are scanned instead.
     */
    private static String scannableText(PipelineStep step) {
        if (step.getDefinition() != null) {
            return step.getDefinition().toString();
        }
        StringJoiner text = new StringJoiner("\n");
        Stream.of(step.getBaseUrl(), step.getEndpoint(), step.getParamMap(), step.getDefaultParams(),
                        step.getDefaults(), step.getHeaders(), step.getJsonBody(), step.getFormBody())
                .filter(Objects::nonNull)
                .forEach(part -> text.add(part.toString()));
        return text.toString();
    }

    public String resolve(String value, Map<String, JsonNode> stepOutputs) {
        if (value == null || stepOutputs.isEmpty()) {
            return value;
        }
        return renderer.render(value, reference -> lookup(reference, stepOutputs));
    }

    /**
     * Resolves references inside every text value of an object, in place.
     */
    public void resolveValues(ObjectNode values, Map<String, JsonNode> stepOutputs) {
        if (values == null || stepOutputs.isEmpty()) {
            return;
        }
        List<String> names = new ArrayList<>();
        values.fieldNames().forEachRemaining(names::add);
        for (String name : names) {
            JsonNode value = values.get(name);
            if (value.isTextual()) {
                values.set(name, TextNode.valueOf(resolve(value.textValue(), stepOutputs)));
            }
        }
    }

    /**
     * Resolves references inside every value of a text map, in place.
     */
    public void resolveValues(Map<String, String> values, Map<String, JsonNode> stepOutputs) {
        if (values == null || stepOutputs.isEmpty()) {
            return;
        }
        values.replaceAll((key, value) -> resolve(value, stepOutputs));
    }

    private static String lookup(String reference, Map<String, JsonNode> stepOutputs) {
        int dot = reference.indexOf('.');
        JsonNode output = stepOutputs.get(reference.substring(0, dot));
        if (output == null) {
            return null;
        }
        String field = reference.substring(dot + 1);
        if (RESULT_FIELD.equals(field)) {
            return toParameterText(output);
        }
        if (output.isObject()) {
            return toParameterText(output.get(field));
        }
        return null;
    }

    private static String toParameterText(JsonNode value) {
        if (value != null && value.isArray()) {
            StringJoiner joined = new StringJoiner(",");
            value.forEach(item -> joined.add(JsonValues.asText(item)));
            return joined.toString();
        }
        return JsonValues.asText(value);
    }
}
