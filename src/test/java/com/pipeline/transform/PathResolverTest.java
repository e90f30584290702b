package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static com.pipeline.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class PathResolverTest {

    @Test
    void resolve_shouldWalkDottedAndBracketedPaths() {
        JsonNode data = json("{'data': {'items': [{'name': 'first'}, {'name': 'second'}]}}");

        assertThat(PathResolver.resolve(data, "data.items[1].name").asText()).isEqualTo("second");
        assertThat(PathResolver.resolve(data, "data.items").size()).isEqualTo(2);
    }

    @Test
    void resolve_shouldSupportBareIndexSegments() {
        JsonNode data = json("{'rows': [[10, 20], [30, 40]]}");

        assertThat(PathResolver.resolve(data, "rows[1].[0]").intValue()).isEqualTo(30);
    }

    @Test
    void resolve_shouldReturnNullWhenAnySegmentIsMissing() {
        JsonNode data = json("{'a': {'b': 1}}");

        assertThat(PathResolver.resolve(data, "a.c").isNull()).isTrue();
        assertThat(PathResolver.resolve(data, "a.b.c").isNull()).isTrue();
        assertThat(PathResolver.resolve(data, "a[0]").isNull()).isTrue();
    }

    @Test
    void resolve_shouldReturnDataForEmptyPath() {
        JsonNode data = json("{'a': 1}");

        assertThat(PathResolver.resolve(data, "")).isSameAs(data);
        assertThat(PathResolver.resolve(data, (String) null)).isSameAs(data);
    }

    @Test
    void resolve_shouldNotReTraverseAnAlreadyExtractedValue() {
        JsonNode data = json("{'a': {'b': 1}}");

        JsonNode once = PathResolver.resolve(data, "a");
        assertThat(PathResolver.resolve(once, "a").isNull()).isTrue();
    }

    @Test
    void resolve_shouldLookOneLevelInsideXmlWrappers() {
        JsonNode data = json("{'header': {'resultCode': '00'}, 'body': {'items': {'item': [{'id': 1}]}}}");

        assertThat(PathResolver.resolve(data, "items.item[0].id").intValue()).isEqualTo(1);
    }

    @Test
    void resolve_shouldLookTwoLevelsInsideXmlWrappers() {
        JsonNode data = json("{'response': {'body': {'totalCount': 7}}}");

        assertThat(PathResolver.resolve(data, "totalCount").intValue()).isEqualTo(7);
    }

    @Test
    void resolve_shouldPreferTheLiteralKeyOverWrappers() {
        JsonNode data = json("{'items': 'direct', 'body': {'items': 'wrapped'}}");

        assertThat(PathResolver.resolve(data, "items").asText()).isEqualTo("direct");
    }

    @Test
    void resolveIndex_shouldIndexTopLevelArrayOnly() {
        JsonNode array = json("[{'x': 1}, {'x': 2}]");

        assertThat(PathResolver.resolve(array, 1).get("x").intValue()).isEqualTo(2);
        assertThat(PathResolver.resolve(array, 5).isNull()).isTrue();
        assertThat(PathResolver.resolve(json("{'x': 1}"), 0).isNull()).isTrue();
    }
}
