package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pipeline.model.transform.WrapSpec;
import com.pipeline.model.transform.WrapValue;

import java.util.Map;

/**
 * Builds the envelope object described by a {@link WrapSpec}. Used both as the terminal stage of
 * a response transform and by the merge step of a pipeline.
 */
public final class WrapBuilder {

    static final String COUNT_KEY = "_count";

    private WrapBuilder() {
    }

    /**
     * Size of a result: an array's length, otherwise 1 or 0 depending on whether the value is empty.
     */
    public static int countOf(JsonNode results) {
        if (results != null && results.isArray()) {
            return results.size();
        }
        return JsonValues.isTruthy(results) ? 1 : 0;
    }

    /**
     * @param spec    the envelope description
     * @param results the value {@code _results} stands for
     * @param count   the value {@code _count} stands for
     * @param raw     the untransformed response for {@code from_root}; {@code null} when there is none
     * @param input   the caller's original input
     */
    public static ObjectNode build(WrapSpec spec, JsonNode results, int count, JsonNode raw, JsonNode input) {
        ObjectNode envelope = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, WrapValue> entry : spec.entries().entrySet()) {
            envelope.set(entry.getKey(), valueFor(entry.getValue(), results, count, raw, input));
        }
        return envelope;
    }

    private static JsonNode valueFor(WrapValue value, JsonNode results, int count, JsonNode raw, JsonNode input) {
        if (value instanceof WrapValue.Results) {
            return JsonValues.orNull(results);
        }
        if (value instanceof WrapValue.Count) {
            return IntNode.valueOf(count);
        }
        if (value instanceof WrapValue.FromRoot fromRoot) {
            return fromRoot(raw, fromRoot.path());
        }
        if (value instanceof WrapValue.Template template) {
            return TextNode.valueOf(TemplateRenderer.simple().render(template.template(), key -> {
                if (COUNT_KEY.equals(key)) {
                    return String.valueOf(count);
                }
                return input != null && input.has(key) ? JsonValues.asText(input.get(key)) : null;
            }));
        }
        if (value instanceof WrapValue.FromInput fromInput) {
            JsonNode found = input == null ? null : input.get(fromInput.key());
            return found == null ? TextNode.valueOf("") : found;
        }
        return ((WrapValue.Literal) value).value().deepCopy();
    }

    private static JsonNode fromRoot(JsonNode raw, String path) {
        if (raw == null || !raw.isObject() || path == null) {
            return IntNode.valueOf(0);
        }
        if (path.contains(".")) {
            JsonNode found = PathResolver.resolve(raw, path);
            return JsonValues.isNull(found) ? IntNode.valueOf(0) : found;
        }
        JsonNode found = raw.get(path);
        return found == null ? IntNode.valueOf(0) : found;
    }
}
