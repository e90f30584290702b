package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pipeline.model.transform.FieldSpec;

import java.time.ZoneId;
import java.util.Map;

/**
 * Projects one record into a new object according to a decoded {@code fields} mapping.
 * <p>
 * Per output key the precedence is: constant, template, then a sourced field with its default
 * and coercions. A sourced value that is still null after defaulting becomes {@code ""} before
 * any coercion runs.
 */
public class FieldMapper {

    private final ValueCoercions coercions;

    public FieldMapper(ZoneId zone) {
        this.coercions = new ValueCoercions(zone);
    }

    public ObjectNode map(JsonNode record, Map<String, FieldSpec> fields) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, FieldSpec> entry : fields.entrySet()) {
            result.set(entry.getKey(), project(record, entry.getValue()));
        }
        return result;
    }

    private JsonNode project(JsonNode record, FieldSpec spec) {
        if (spec instanceof FieldSpec.Constant constant) {
            return constant.value().deepCopy();
        }
        if (spec instanceof FieldSpec.Template template) {
            return TextNode.valueOf(TemplateRenderer.simple().render(template.template(),
                    key -> record.has(key) ? JsonValues.asText(record.get(key)) : null));
        }
        if (spec instanceof FieldSpec.Shorthand shorthand) {
            JsonNode value = record.get(shorthand.field());
            return value == null ? TextNode.valueOf("") : value.deepCopy();
        }
        FieldSpec.Source source = (FieldSpec.Source) spec;
        JsonNode value = read(record, source.from());
        if (JsonValues.isNull(value) && source.defaultValue() != null) {
            value = source.defaultValue();
        }
        if (JsonValues.isNull(value)) {
            value = TextNode.valueOf("");
        }
        return coercions.apply(value.deepCopy(), source.coercions());
    }

    private static JsonNode read(JsonNode record, String from) {
        if (from == null) {
            return null;
        }
        if (from.contains(".")) {
            return PathResolver.resolve(record, from);
        }
        return record.get(from);
    }
}
