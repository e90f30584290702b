package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipeline.model.transform.WrapSpec;
import org.junit.jupiter.api.Test;

import static com.pipeline.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class WrapBuilderTest {

    @Test
    void countOf_shouldUseLengthForListsAndTruthinessOtherwise() {
        assertThat(WrapBuilder.countOf(json("[1, 2, 3]"))).isEqualTo(3);
        assertThat(WrapBuilder.countOf(json("{'a': 1}"))).isEqualTo(1);
        assertThat(WrapBuilder.countOf(json("'text'"))).isEqualTo(1);
        assertThat(WrapBuilder.countOf(json("{}"))).isZero();
        assertThat(WrapBuilder.countOf(json("null"))).isZero();
        assertThat(WrapBuilder.countOf(null)).isZero();
    }

    @Test
    void build_shouldResolveEveryKindOfEntry() {
        WrapSpec spec = wrap("{'success': true, 'data': '_results', 'count': '_count',"
                + " 'total': {'from_root': 'meta.total'}, 'page': {'from_root': 'page'},"
                + " 'message': {'template': '{query}: {_count} found {nope}'},"
                + " 'query': {'from_input': 'query'}, 'lang': {'from_input': 'lang'}}");
        JsonNode results = json("[{'id': 1}, {'id': 2}]");
        JsonNode raw = json("{'meta': {'total': 40}, 'page': 2}");
        JsonNode input = json("{'query': 'pizza'}");

        ObjectNode built = WrapBuilder.build(spec, results, WrapBuilder.countOf(results), raw, input);

        assertThat(built).isEqualTo(json("{'success': true, 'data': [{'id': 1}, {'id': 2}], 'count': 2,"
                + " 'total': 40, 'page': 2, 'message': 'pizza: 2 found ', 'query': 'pizza', 'lang': ''}"));
    }

    @Test
    void fromRoot_shouldDefaultToZeroWithoutRawResponse() {
        WrapSpec spec = wrap("{'total': {'from_root': 'meta.total'}, 'missing': {'from_root': 'nope'}}");

        ObjectNode withoutRaw = WrapBuilder.build(spec, json("[]"), 0, null, json("{}"));
        ObjectNode withRaw = WrapBuilder.build(spec, json("[]"), 0, json("{'meta': {}}"), json("{}"));

        assertThat(withoutRaw.get("total").intValue()).isZero();
        assertThat(withRaw.get("total").intValue()).isZero();
        assertThat(withRaw.get("missing").intValue()).isZero();
    }

    private static WrapSpec wrap(String json) {
        return TransformConfigDecoder.decodeWrap(json(json)).orElseThrow();
    }
}
