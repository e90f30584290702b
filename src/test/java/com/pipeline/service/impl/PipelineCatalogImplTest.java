package com.pipeline.service.impl;

import com.pipeline.model.MergeConfig;
import com.pipeline.model.PipelineDefinition;
import com.pipeline.model.PipelineStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineCatalogImplTest {

    private final PipelineCatalogImpl catalog = new PipelineCatalogImpl();

    @Test
    void list_shouldBeOrderedByName() {
        catalog.register(definition("weather", "w"));
        catalog.register(definition("books", "b"));

        assertThat(catalog.list()).extracting(PipelineDefinition::name).containsExactly("books", "weather");
    }

    @Test
    void register_shouldReplaceExistingDefinition() {
        catalog.register(definition("books", "old"));
        catalog.register(definition("books", "new"));

        assertThat(catalog.list()).hasSize(1);
        assertThat(catalog.find("books")).hasValueSatisfying(found ->
                assertThat(found.description()).isEqualTo("new"));
    }

    @Test
    void find_shouldReturnEmptyForUnknownNames() {
        assertThat(catalog.find("nope")).isEmpty();
        assertThat(catalog.find(null)).isEmpty();
    }

    private static PipelineDefinition definition(String name, String description) {
        PipelineStep step = PipelineStep.builder().id("a").service("kakao").build();
        return new PipelineDefinition(name, description, List.of(step), MergeConfig.DEFAULT);
    }
}
