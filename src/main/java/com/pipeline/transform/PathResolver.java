package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves dotted/bracketed addresses such as {@code data.items[0].name} against nested JSON.
 * <p>
 * Responses converted from XML carry extra wrapper elements, so when an object lacks the requested
 * key the resolver also looks one level inside {@link #WRAPPER_KEYS} and two levels through
 * {@link #NESTED_WRAPPER_KEYS}. Resolution failures produce {@link NullNode}, never an exception.
 */
public final class PathResolver {

    static final List<String> WRAPPER_KEYS = List.of("body", "response", "dbs", "items", "result", "data");
    static final List<String> NESTED_WRAPPER_KEYS = List.of("body", "items", "result", "data");

    private static final Pattern SEGMENT =
            Pattern.compile("^(\\w*)(?:\\[(\\d+)])?$", Pattern.UNICODE_CHARACTER_CLASS);

    private PathResolver() {
    }

    /**
     * Indexes into a top-level array.
     */
    public static JsonNode resolve(JsonNode data, int index) {
        if (data == null) {
            return NullNode.getInstance();
        }
        if (data.isArray() && index >= 0 && index < data.size()) {
            return data.get(index);
        }
        return NullNode.getInstance();
    }

    /**
     * Walks {@code path} segment by segment. A {@code null} data or path returns the data as-is,
     * and so does an empty path.
     */
    public static JsonNode resolve(JsonNode data, String path) {
        if (data == null) {
            return NullNode.getInstance();
        }
        if (path == null || path.isEmpty()) {
            return data;
        }
        JsonNode current = data;
        for (Object part : parse(path)) {
            if (JsonValues.isNull(current)) {
                return NullNode.getInstance();
            }
            if (part instanceof Long index) {
                if (current.isArray() && index < current.size()) {
                    current = current.get(index.intValue());
                } else {
                    return NullNode.getInstance();
                }
            } else if (current.isObject()) {
                String key = (String) part;
                JsonNode next = current.has(key) ? current.get(key) : findInWrappers(current, key);
                if (next == null) {
                    return NullNode.getInstance();
                }
                current = next;
            } else {
                return NullNode.getInstance();
            }
        }
        return JsonValues.orNull(current);
    }

    /**
     * Splits a path into keys and indexes: {@code "data[0].name"} becomes {@code [data, 0, name]}.
     */
    static List<Object> parse(String path) {
        List<Object> parts = new ArrayList<>();
        for (String segment : path.split("\\.")) {
            if (segment.isEmpty()) {
                continue;
            }
            Matcher matcher = SEGMENT.matcher(segment);
            if (!matcher.matches()) {
                parts.add(segment);
                continue;
            }
            String name = matcher.group(1);
            String index = matcher.group(2);
            if (!name.isEmpty()) {
                parts.add(name);
            }
            if (index != null) {
                try {
                    parts.add(Long.parseLong(index));
                } catch (NumberFormatException e) {
                    parts.add(Long.MAX_VALUE);
                }
            }
        }
        return parts;
    }

    private static JsonNode findInWrappers(JsonNode object, String key) {
        for (String wrapperKey : WRAPPER_KEYS) {
            JsonNode wrapper = object.get(wrapperKey);
            if (wrapper == null || !wrapper.isObject()) {
                continue;
            }
            if (wrapper.has(key)) {
                return wrapper.get(key);
            }
            for (String nestedKey : NESTED_WRAPPER_KEYS) {
                JsonNode nested = wrapper.get(nestedKey);
                if (nested != null && nested.isObject() && nested.has(key)) {
                    return nested.get(key);
                }
            }
        }
        return null;
    }
}
