package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipeline.model.transform.FieldSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.pipeline.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class FieldMapperTest {

    private FieldMapper fieldMapper;

    @BeforeEach
    void setUp() {
        fieldMapper = new FieldMapper(ZoneId.of("UTC"));
    }

    @Test
    void map_shouldApplyEachKindOfFieldSpec() {
        JsonNode record = json("{'place_name': 'Cafe', 'x': '127.1', 'location': {'city': 'Seoul'}}");

        ObjectNode mapped = fieldMapper.map(record, fields(
                "name {'from': 'place_name'}",
                "city {'from': 'location.city'}",
                "kind {'value': 'cafe'}",
                "label {'template': '{place_name} @ {x} {missing}'}",
                "lng 'x'"));

        assertThat(mapped).isEqualTo(json(
                "{'name': 'Cafe', 'city': 'Seoul', 'kind': 'cafe', 'label': 'Cafe @ 127.1 ', 'lng': '127.1'}"));
    }

    @Test
    void map_shouldPreferConstantOverTemplateAndSource() {
        ObjectNode mapped = fieldMapper.map(json("{'a': 'from-record'}"),
                fields("out {'value': 42, 'template': '{a}', 'from': 'a'}"));

        assertThat(mapped.get("out").intValue()).isEqualTo(42);
    }

    @Test
    void map_shouldFallBackToDefaultThenEmptyString() {
        ObjectNode mapped = fieldMapper.map(json("{'phone': null}"), fields(
                "phone {'from': 'phone', 'default': 'n/a'}",
                "email {'from': 'email'}",
                "missing_shorthand 'nope'"));

        assertThat(mapped.get("phone").asText()).isEqualTo("n/a");
        assertThat(mapped.get("email").asText()).isEmpty();
        assertThat(mapped.get("missing_shorthand").asText()).isEmpty();
    }

    @Test
    void map_shouldStripHtmlAndDecodeEntities() {
        ObjectNode mapped = fieldMapper.map(json("{'title': '<b>Pizza</b>   &amp;\\n Pasta'}"),
                fields("title {'from': 'title', 'clean_html': true}"));

        assertThat(mapped.get("title").asText()).isEqualTo("Pizza & Pasta");
    }

    @Test
    void map_shouldFormatPositiveEpochSecondsOnly() {
        JsonNode record = json("{'created': 1700000000, 'zero': 0, 'text': '1700000000', 'huge': 1e20}");

        ObjectNode mapped = fieldMapper.map(record, fields(
                "created {'from': 'created', 'timestamp_to_str': '%Y-%m-%d %H:%M'}",
                "zero {'from': 'zero', 'timestamp_to_str': '%Y'}",
                "text {'from': 'text', 'timestamp_to_str': '%Y'}",
                "huge {'from': 'huge', 'timestamp_to_str': '%Y'}"));

        assertThat(mapped.get("created").asText()).isEqualTo("2023-11-14 22:13");
        assertThat(mapped.get("zero").asText()).isEmpty();
        assertThat(mapped.get("text").asText()).isEmpty();
        assertThat(mapped.get("huge").asText()).isEmpty();
    }

    @Test
    void map_shouldCoerceToIntBestEffort() {
        JsonNode record = json("{'count': '42', 'rating': 4.7, 'name': 'abc'}");

        ObjectNode mapped = fieldMapper.map(record, fields(
                "count {'from': 'count', 'to_int': true}",
                "rating {'from': 'rating', 'to_int': true}",
                "name {'from': 'name', 'to_int': true}"));

        assertThat(mapped.get("count").isInt()).isTrue();
        assertThat(mapped.get("count").intValue()).isEqualTo(42);
        assertThat(mapped.get("rating").intValue()).isEqualTo(4);
        assertThat(mapped.get("name").asText()).isEqualTo("abc");
    }

    @Test
    void map_shouldRunToIntBeforeToStr() {
        ObjectNode mapped = fieldMapper.map(json("{'n': 3.9}"),
                fields("n {'from': 'n', 'to_int': true, 'to_str': true}"));

        assertThat(mapped.get("n").isTextual()).isTrue();
        assertThat(mapped.get("n").asText()).isEqualTo("3");
    }

    /**
     * Each entry is "outputKey specJson".
     */
    private static Map<String, FieldSpec> fields(String... entries) {
        Map<String, FieldSpec> specs = new LinkedHashMap<>();
        for (String entry : entries) {
            int space = entry.indexOf(' ');
            specs.put(entry.substring(0, space), TransformConfigDecoder.decodeFieldSpec(json(entry.substring(space + 1))));
        }
        return specs;
    }
}
