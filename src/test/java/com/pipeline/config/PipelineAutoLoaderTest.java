package com.pipeline.config;

import com.pipeline.model.PipelineDefinition;
import com.pipeline.service.impl.PipelineCatalogImpl;
import com.pipeline.service.impl.PipelineDefinitionParserImpl;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineAutoLoaderTest {

    @TempDir
    Path directory;

    private final PipelineCatalogImpl catalog = new PipelineCatalogImpl();

    @Test
    void run_shouldLoadValidDefinitionsAndSkipBrokenOnes() throws IOException {
        Files.writeString(directory.resolve("a-books.yml"), "pipeline:\n  - {id: search, service: books}\n");
        Files.writeString(directory.resolve("b-weather.json"),
                "{\"name\": \"weather\", \"pipeline\": [{\"service\": \"kma\"}], \"merge\": {\"mode\": \"last\"}}");
        Files.writeString(directory.resolve("c-broken.yaml"), "pipeline: []\n");
        Files.writeString(directory.resolve("notes.txt"), "pipeline: not a definition\n");

        loader(directory.toString()).run();

        assertThat(catalog.list()).extracting(PipelineDefinition::name).containsExactly("a-books", "weather");
    }

    @Test
    void run_withMissingDirectory_shouldLeaveCatalogEmpty() {
        loader(directory.resolve("absent").toString()).run();

        assertThat(catalog.list()).isEmpty();
    }

    @Test
    void isDefinitionFile_shouldMatchYamlAndJson() {
        assertThat(PipelineAutoLoader.isDefinitionFile("a.YML")).isTrue();
        assertThat(PipelineAutoLoader.isDefinitionFile("a.yaml")).isTrue();
        assertThat(PipelineAutoLoader.isDefinitionFile("a.json")).isTrue();
        assertThat(PipelineAutoLoader.isDefinitionFile("a.yml.bak")).isFalse();
    }

    private PipelineAutoLoader loader(String path) {
        PipelineAutoLoader loader = new PipelineAutoLoader(new PipelineDefinitionParserImpl(), catalog);
        ReflectionTestUtils.setField(loader, "definitionsDirectoryPath", path);
        return loader;
    }
}
