package com.pipeline.transform;

import com.pipeline.exception.PipelineConfigurationException;
import com.pipeline.model.transform.ExtractPath;
import com.pipeline.model.transform.FieldSpec;
import com.pipeline.model.transform.FilterCondition;
import com.pipeline.model.transform.FilterOperator;
import com.pipeline.model.transform.SortSpec;
import com.pipeline.model.transform.TransformConfig;
import com.pipeline.model.transform.WrapSpec;
import com.pipeline.model.transform.WrapValue;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.pipeline.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformConfigDecoderTest {

    @Test
    void decode_shouldTreatFalsyStagesAsAbsent() {
        TransformConfig config = TransformConfigDecoder.decode(
                json("{'extract': '', 'first': false, 'fields': {}, 'sort': {}, 'limit': 0, 'wrap': {}}"));

        assertThat(config).isEqualTo(TransformConfig.EMPTY);
    }

    @Test
    void decode_shouldIgnoreNegativeAndNonNumericLimits() {
        assertThat(TransformConfigDecoder.decode(json("{'limit': -3}")).limit()).isEmpty();
        assertThat(TransformConfigDecoder.decode(json("{'limit': 'ten'}")).limit()).isEmpty();
        assertThat(TransformConfigDecoder.decode(json("{'limit': 10}")).limit()).hasValue(10);
    }

    @Test
    void decode_shouldReadExtractAsKeyOrIndex() {
        assertThat(TransformConfigDecoder.decode(json("{'extract': 'a.b'}")).extract())
                .contains(new ExtractPath.Key("a.b"));
        assertThat(TransformConfigDecoder.decode(json("{'extract': 0}")).extract())
                .contains(new ExtractPath.Index(0));
    }

    @Test
    void decode_shouldRejectMalformedBlocks() {
        assertThatThrownBy(() -> TransformConfigDecoder.decode(json("['extract']")))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("'response' must be a mapping");
        assertThatThrownBy(() -> TransformConfigDecoder.decode(json("{'extract': true}")))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("'extract'");
    }

    @Test
    void decode_shouldPickFirstOperatorByPrecedence() {
        TransformConfig config = TransformConfigDecoder.decode(
                json("{'filter': [{'field': 'a', 'gt': 1, 'eq': 2}, {'field': 'b'}, 'ignored']}"));

        assertThat(config.filter()).hasValueSatisfying(conditions -> assertThat(conditions).containsExactly(
                new FilterCondition("a", FilterOperator.EQ, json("2")),
                new FilterCondition("b", null, null)));
    }

    @Test
    void decode_shouldDefaultSortToAscendingTextOrder() {
        assertThat(TransformConfigDecoder.decode(json("{'sort': {'by': 'name'}}")).sort())
                .contains(new SortSpec("name", false, false));
        assertThat(TransformConfigDecoder.decode(json("{'sort': {'by': 'd', 'order': 'desc', 'type': 'number'}}")).sort())
                .contains(new SortSpec("d", true, true));
    }

    @Test
    void decodeFieldSpec_shouldClassifyEachForm() {
        assertThat(TransformConfigDecoder.decodeFieldSpec(json("'title'"))).isEqualTo(new FieldSpec.Shorthand("title"));
        assertThat(TransformConfigDecoder.decodeFieldSpec(json("{'value': 1, 'from': 'x'}")))
                .isEqualTo(new FieldSpec.Constant(json("1")));
        assertThat(TransformConfigDecoder.decodeFieldSpec(json("{'template': '{a}'}")))
                .isEqualTo(new FieldSpec.Template("{a}"));
        assertThat(TransformConfigDecoder.decodeFieldSpec(json("{'from': 'x', 'to_int': true}")))
                .isInstanceOfSatisfying(FieldSpec.Source.class, source -> {
                    assertThat(source.from()).isEqualTo("x");
                    assertThat(source.coercions().toInt()).isTrue();
                    assertThat(source.coercions().cleanHtml()).isFalse();
                });
    }

    @Test
    void decodeWrap_shouldClassifyEntries() {
        WrapSpec spec = TransformConfigDecoder.decodeWrap(json("{'a': '_results', 'b': '_count',"
                + " 'c': {'from_root': 'x.y'}, 'd': {'template': 't'}, 'e': {'from_input': 'q'},"
                + " 'f': 'plain', 'g': {'other': 1}}")).orElseThrow();

        assertThat(spec.entries()).containsExactly(
                entry("a", new WrapValue.Results()),
                entry("b", new WrapValue.Count()),
                entry("c", new WrapValue.FromRoot("x.y")),
                entry("d", new WrapValue.Template("t")),
                entry("e", new WrapValue.FromInput("q")),
                entry("f", new WrapValue.Literal(json("'plain'"))),
                entry("g", new WrapValue.Literal(json("{'other': 1}"))));
    }

    private static Map.Entry<String, WrapValue> entry(String key, WrapValue value) {
        return Map.entry(key, value);
    }
}
