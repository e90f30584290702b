package com.pipeline.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.model.MergeConfig;
import com.pipeline.model.MergeMode;
import com.pipeline.model.OnError;
import com.pipeline.model.StepOutcome;
import com.pipeline.model.transform.WrapSpec;
import com.pipeline.transform.TransformConfigDecoder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.pipeline.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class MergeEngineTest {

    private final MergeEngine mergeEngine = new MergeEngine();

    @Test
    void concat_shouldFlattenListsAndWellKnownKeys() {
        List<StepOutcome> outcomes = List.of(
                ok("a", json("[{'n': 1}, {'n': 2}]")),
                ok("b", json("{'items': [{'n': 3}], 'data': 'ignored'}")),
                ok("c", json("{'n': 4}")),
                ok("d", json("'scalar'")));

        JsonNode merged = mergeEngine.merge(outcomes, config(MergeMode.CONCAT, false, null), json("{}"));

        assertThat(merged).isEqualTo(json("[{'n': 1}, {'n': 2}, {'n': 3}, {'n': 4}]"));
    }

    @Test
    void concat_shouldTagObjectsWithTheirSourceStep() {
        JsonNode kakao = json("[{'name': 'A'}, {'name': 'B', 'source': 'manual'}, 'text']");
        List<StepOutcome> outcomes = List.of(ok("kakao", kakao), ok("naver", json("{'results': [{'name': 'C'}]}")));

        JsonNode merged = mergeEngine.merge(outcomes, config(MergeMode.CONCAT, true, null), json("{}"));

        assertThat(merged).isEqualTo(json("[{'name': 'A', 'source': 'kakao'}, {'name': 'B', 'source': 'manual'},"
                + " 'text', {'name': 'C', 'source': 'naver'}]"));
        assertThat(kakao.get(0).has("source")).isFalse();
    }

    @Test
    void concat_shouldReturnErrorOfRequiredStep() {
        List<StepOutcome> outcomes = List.of(
                ok("a", json("[1]")),
                failed("b", OnError.STOP, "Server error (HTTP 500)"),
                ok("c", json("[2]")));

        JsonNode merged = mergeEngine.merge(outcomes, config(MergeMode.CONCAT, false, null), json("{}"));

        assertThat(merged).isEqualTo(json("{'error': 'Server error (HTTP 500)'}"));
    }

    @Test
    void concat_shouldSkipOptionalFailuresAndWrap() {
        List<StepOutcome> outcomes = List.of(
                failed("a", OnError.CONTINUE, "Request timed out (10s)"),
                ok("b", json("[1, 2]")),
                ok("c", json("[3]")));
        WrapSpec wrap = wrap("{'success': true, 'items': '_results', 'count': '_count',"
                + " 'message': {'template': '{query}: {_count}'}, 'total': {'from_root': 'meta.total'}}");

        JsonNode merged = mergeEngine.merge(outcomes, config(MergeMode.CONCAT, false, wrap), json("{'query': 'q'}"));

        assertThat(merged).isEqualTo(json("{'success': true, 'items': [1, 2, 3], 'count': 3, 'message': 'q: 3', 'total': 0}"));
    }

    @Test
    void sequentialMode_shouldMergeLikeConcat() {
        List<StepOutcome> outcomes = List.of(ok("a", json("[1]")), ok("b", json("[2]")));

        assertThat(mergeEngine.merge(outcomes, config(MergeMode.SEQUENTIAL, false, null), json("{}")))
                .isEqualTo(json("[1, 2]"));
    }

    @Test
    void firstSuccess_shouldReturnFirstSuccessfulOutcome() {
        List<StepOutcome> outcomes = List.of(
                failed("a", OnError.STOP, "Access denied (HTTP 403)"),
                ok("b", json("{'items': [1]}")),
                ok("c", json("[2]")));

        assertThat(mergeEngine.merge(outcomes, config(MergeMode.FIRST_SUCCESS, false, null), json("{}")))
                .isEqualTo(json("{'items': [1]}"));
    }

    @Test
    void firstSuccess_withWrap_shouldWrapTheListView() {
        List<StepOutcome> outcomes = List.of(ok("b", json("{'items': [1, 2]}")));
        WrapSpec wrap = wrap("{'data': '_results', 'count': '_count', 'query': {'from_input': 'query'}}");

        JsonNode merged = mergeEngine.merge(outcomes, config(MergeMode.FIRST_SUCCESS, false, wrap), json("{'query': 'x'}"));

        assertThat(merged).isEqualTo(json("{'data': [1, 2], 'count': 2, 'query': 'x'}"));
    }

    @Test
    void firstSuccess_withWrap_shouldKeepScalarResultAsIs() {
        List<StepOutcome> outcomes = List.of(ok("b", json("'only text'")));
        WrapSpec wrap = wrap("{'data': '_results', 'count': '_count'}");

        JsonNode merged = mergeEngine.merge(outcomes, config(MergeMode.FIRST_SUCCESS, false, wrap), json("{}"));

        assertThat(merged).isEqualTo(json("{'data': 'only text', 'count': 0}"));
    }

    @Test
    void firstSuccess_shouldReportEveryFailure() {
        List<StepOutcome> outcomes = List.of(
                failed("a", OnError.CONTINUE, "Network connection failed"),
                failed("b", OnError.STOP, "Rate limit exceeded (HTTP 429)"));

        JsonNode merged = mergeEngine.merge(outcomes, config(MergeMode.FIRST_SUCCESS, false, null), json("{}"));

        assertThat(merged).isEqualTo(json("{'error': 'All pipeline steps failed.', 'details': {"
                + "'a': {'error': 'Network connection failed'}, 'b': {'error': 'Rate limit exceeded (HTTP 429)'}}}"));
    }

    @Test
    void last_shouldReturnLastSuccessfulOutcome() {
        List<StepOutcome> outcomes = List.of(
                ok("search", json("['1', '2']")),
                ok("summary", json("{'result': {}}")),
                failed("extra", OnError.CONTINUE, "Resource not found (HTTP 404)"));

        assertThat(mergeEngine.merge(outcomes, config(MergeMode.LAST, false, null), json("{}")))
                .isEqualTo(json("{'result': {}}"));
    }

    @Test
    void last_withoutSuccess_shouldReportNoResults() {
        List<StepOutcome> outcomes = List.of(failed("a", OnError.CONTINUE, "boom"));

        assertThat(mergeEngine.merge(outcomes, config(MergeMode.LAST, false, null), json("{}")))
                .isEqualTo(json("{'error': 'Pipeline produced no results.'}"));
    }

    @Test
    void listView_shouldContributeNothingForScalars() {
        assertThat(MergeEngine.listView(json("42"))).isEmpty();
        assertThat(MergeEngine.listView(json("null"))).isEmpty();
        assertThat(MergeEngine.listView(json("{'restaurants': [1], 'combined': [2]}"))).containsExactly(json("1"));
    }

    private static StepOutcome ok(String id, JsonNode data) {
        return new StepOutcome(id, 0, data, true, OnError.STOP);
    }

    private static StepOutcome failed(String id, OnError onError, String message) {
        return new StepOutcome(id, 0, json("{'error': '" + message + "'}"), false, onError);
    }

    private static MergeConfig config(MergeMode mode, boolean sourceTag, WrapSpec wrap) {
        return new MergeConfig(mode, sourceTag, Optional.ofNullable(wrap), false);
    }

    private static WrapSpec wrap(String json) {
        return TransformConfigDecoder.decodeWrap(json(json)).orElseThrow();
    }
}
