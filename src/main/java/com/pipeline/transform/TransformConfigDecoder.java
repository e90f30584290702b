package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.exception.PipelineConfigurationException;
import com.pipeline.model.transform.ExtractPath;
import com.pipeline.model.transform.FieldCoercions;
import com.pipeline.model.transform.FieldSpec;
import com.pipeline.model.transform.FilterCondition;
import com.pipeline.model.transform.FilterOperator;
import com.pipeline.model.transform.SortSpec;
import com.pipeline.model.transform.TransformConfig;
import com.pipeline.model.transform.WrapSpec;
import com.pipeline.model.transform.WrapValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decodes the loosely-typed {@code response} and {@code wrap} blocks of a pipeline definition into
 * their typed form, once, at load time.
 * <p>
 * A stage whose value is empty or false ({@code first: false}, {@code fields: {}}, {@code limit: 0})
 * is treated as absent.
 */
public final class TransformConfigDecoder {

    private TransformConfigDecoder() {
    }

    public static TransformConfig decode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return TransformConfig.EMPTY;
        }
        if (!node.isObject()) {
            throw new PipelineConfigurationException("'response' must be a mapping, got: " + node.getNodeType());
        }
        return new TransformConfig(
                decodeExtract(node.get("extract")),
                JsonValues.isTruthy(node.get("first")),
                decodeFields(node.get("fields")),
                decodeFilter(node.get("filter")),
                decodeSort(node.get("sort")),
                decodeLimit(node.get("limit")),
                decodeWrap(node.get("wrap")));
    }

    /**
     * Decodes a wrap block; also used for the {@code merge.wrap} block.
     */
    public static Optional<WrapSpec> decodeWrap(JsonNode node) {
        if (node == null || !node.isObject() || node.size() == 0) {
            return Optional.empty();
        }
        Map<String, WrapValue> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), decodeWrapValue(field.getValue()));
        }
        return Optional.of(new WrapSpec(entries));
    }

    private static WrapValue decodeWrapValue(JsonNode value) {
        if (value.isTextual() && "_results".equals(value.textValue())) {
            return new WrapValue.Results();
        }
        if (value.isTextual() && WrapBuilder.COUNT_KEY.equals(value.textValue())) {
            return new WrapValue.Count();
        }
        if (value.isObject()) {
            if (value.has("from_root")) {
                return new WrapValue.FromRoot(JsonValues.asText(value.get("from_root")));
            }
            if (value.has("template")) {
                return new WrapValue.Template(JsonValues.asText(value.get("template")));
            }
            if (value.has("from_input")) {
                return new WrapValue.FromInput(JsonValues.asText(value.get("from_input")));
            }
        }
        return new WrapValue.Literal(value);
    }

    private static Optional<ExtractPath> decodeExtract(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            return Optional.of(new ExtractPath.Index(node.intValue()));
        }
        if (node.isTextual()) {
            return node.textValue().isEmpty()
                    ? Optional.empty()
                    : Optional.of(new ExtractPath.Key(node.textValue()));
        }
        throw new PipelineConfigurationException("'extract' must be a path or an integer index, got: " + node);
    }

    private static Optional<Map<String, FieldSpec>> decodeFields(JsonNode node) {
        if (node == null || !node.isObject() || node.size() == 0) {
            return Optional.empty();
        }
        Map<String, FieldSpec> specs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            specs.put(field.getKey(), decodeFieldSpec(field.getValue()));
        }
        return Optional.of(specs);
    }

    static FieldSpec decodeFieldSpec(JsonNode config) {
        if (config.isTextual()) {
            return new FieldSpec.Shorthand(config.textValue());
        }
        if (!config.isObject()) {
            return new FieldSpec.Constant(config);
        }
        if (config.has("value")) {
            return new FieldSpec.Constant(config.get("value"));
        }
        if (config.has("template")) {
            return new FieldSpec.Template(JsonValues.asText(config.get("template")));
        }
        String from = config.hasNonNull("from") ? JsonValues.asText(config.get("from")) : null;
        JsonNode defaultValue = config.has("default") && !config.get("default").isNull() ? config.get("default") : null;
        JsonNode timestamp = config.get("timestamp_to_str");
        FieldCoercions coercions = new FieldCoercions(
                JsonValues.isTruthy(config.get("clean_html")),
                timestamp == null || timestamp.isNull() ? null : JsonValues.asText(timestamp),
                JsonValues.isTruthy(config.get("to_int")),
                JsonValues.isTruthy(config.get("to_str")));
        return new FieldSpec.Source(from, defaultValue, coercions);
    }

    private static Optional<List<FilterCondition>> decodeFilter(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        List<FilterCondition> conditions = new ArrayList<>();
        if (node.isObject()) {
            conditions.add(decodeCondition(node));
        } else if (node.isArray()) {
            for (JsonNode condition : node) {
                if (condition.isObject()) {
                    conditions.add(decodeCondition(condition));
                }
            }
        } else {
            return Optional.empty();
        }
        return Optional.of(conditions);
    }

    private static FilterCondition decodeCondition(JsonNode node) {
        String field = node.hasNonNull("field") ? JsonValues.asText(node.get("field")) : "";
        for (FilterOperator operator : FilterOperator.values()) {
            if (node.has(operator.key())) {
                return new FilterCondition(field, operator, node.get(operator.key()));
            }
        }
        return new FilterCondition(field, null, null);
    }

    private static Optional<SortSpec> decodeSort(JsonNode node) {
        if (node == null || !node.isObject() || node.size() == 0) {
            return Optional.empty();
        }
        String by = node.hasNonNull("by") ? JsonValues.asText(node.get("by")) : null;
        boolean descending = "desc".equals(node.path("order").asText("asc"));
        boolean numeric = "number".equals(node.path("type").asText("auto"));
        return Optional.of(new SortSpec(by, descending, numeric));
    }

    private static OptionalInt decodeLimit(JsonNode node) {
        if (node == null || !node.canConvertToInt() || !node.isNumber()) {
            return OptionalInt.empty();
        }
        int limit = node.intValue();
        return limit > 0 ? OptionalInt.of(limit) : OptionalInt.empty();
    }
}
