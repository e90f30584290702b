package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.pipeline.model.transform.ExtractPath;
import com.pipeline.model.transform.FieldSpec;
import com.pipeline.model.transform.TransformConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies a decoded {@link TransformConfig} to a raw service response.
 * <p>
 * The stages run in a fixed order (extract, first, fields, filter, sort, limit, wrap) and each
 * absent stage is skipped. Filter, sort and limit only act on arrays; every other shape passes
 * through them untouched. The engine has no side effects and never throws for malformed data.
 */
@Component
@Slf4j
public class TransformEngine {

    private final FieldMapper fieldMapper;

    public TransformEngine() {
        this(ZoneId.systemDefault());
    }

    /**
     * @param zone time zone used when formatting epoch timestamps
     */
    public TransformEngine(ZoneId zone) {
        this.fieldMapper = new FieldMapper(zone);
    }

    /**
     * @param raw    the response as returned by the service
     * @param config the decoded {@code response} block
     * @param input  the caller's original input, used by wrap templates
     * @return the reshaped value
     */
    public JsonNode transform(JsonNode raw, TransformConfig config, JsonNode input) {
        JsonNode data = JsonValues.orNull(raw);

        if (config.extract().isPresent()) {
            data = extract(data, config.extract().get());
        }

        if (config.first() && data.isArray()) {
            data = data.size() > 0 ? data.get(0) : NullNode.getInstance();
        }

        if (config.fields().isPresent()) {
            data = mapFields(data, config.fields().get());
        }

        if (config.filter().isPresent() && data.isArray()) {
            data = toArray(ConditionEvaluator.filter(elements(data), config.filter().get()));
        }

        if (config.sort().isPresent() && data.isArray()) {
            data = toArray(RecordSorter.sort(elements(data), config.sort().get()));
        }

        if (config.limit().isPresent() && data.isArray()) {
            int limit = config.limit().getAsInt();
            List<JsonNode> all = elements(data);
            data = toArray(all.subList(0, Math.min(limit, all.size())));
        }

        if (config.wrap().isPresent()) {
            return WrapBuilder.build(config.wrap().get(), data, WrapBuilder.countOf(data), raw, input);
        }
        return data;
    }

    private static JsonNode extract(JsonNode data, ExtractPath path) {
        if (path instanceof ExtractPath.Index index) {
            return PathResolver.resolve(data, index.index());
        }
        return PathResolver.resolve(data, ((ExtractPath.Key) path).path());
    }

    private JsonNode mapFields(JsonNode data, Map<String, FieldSpec> fields) {
        if (data.isArray()) {
            ArrayNode mapped = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : data) {
                if (element.isObject()) {
                    mapped.add(fieldMapper.map(element, fields));
                } else {
                    log.debug("Dropping non-object element during field mapping: {}", element);
                }
            }
            return mapped;
        }
        if (data.isObject()) {
            return fieldMapper.map(data, fields);
        }
        return data;
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> list = new ArrayList<>(array.size());
        array.forEach(list::add);
        return list;
    }

    private static ArrayNode toArray(List<JsonNode> elements) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode(elements.size());
        elements.forEach(array::add);
        return array;
    }
}
