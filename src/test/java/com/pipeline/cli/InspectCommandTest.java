package com.pipeline.cli;

import com.pipeline.model.AuthType;
import com.pipeline.model.MergeConfig;
import com.pipeline.model.MergeMode;
import com.pipeline.model.OnError;
import com.pipeline.model.PipelineDefinition;
import com.pipeline.model.PipelineStep;
import com.pipeline.model.ResponseFormat;
import com.pipeline.model.ServiceConfig;
import com.pipeline.service.api.PipelineCatalog;
import com.pipeline.service.api.ServiceRegistry;
import com.pipeline.transform.TransformConfigDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.pipeline.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InspectCommandTest {

    @Mock
    private PipelineCatalog catalog;

    @Mock
    private ServiceRegistry serviceRegistry;

    private InspectCommand inspectCommand;

    private final PipelineDefinition definition = new PipelineDefinition(
            "pubmed_search",
            "Search, then summarize",
            List.of(
                    PipelineStep.builder().id("search").service("pubmed").endpoint("/esearch.fcgi")
                            .paramMapping("query", "term")
                            .response(TransformConfigDecoder.decode(json("{'extract': 'esearchresult.idlist'}")))
                            .build(),
                    PipelineStep.builder().id("summary").service("pubmed").endpoint("/esummary.fcgi")
                            .onError(OnError.CONTINUE).build()),
            new MergeConfig(MergeMode.LAST, false, Optional.empty(), true));

    @BeforeEach
    void setUp() {
        inspectCommand = new InspectCommand(catalog, serviceRegistry);
    }

    @Test
    void pipelines_whenCatalogIsEmpty_suggestsLoading() {
        when(catalog.list()).thenReturn(List.of());

        assertThat(inspectCommand.pipelines()).contains("No pipelines loaded. Use the 'load' command first.");
    }

    @Test
    void pipelines_listsEveryDefinition() {
        when(catalog.list()).thenReturn(List.of(definition));

        String output = inspectCommand.pipelines();

        assertThat(output).contains("Loaded pipelines:")
                .contains("pubmed_search")
                .contains("(2 steps, last)")
                .contains("Search, then summarize");
    }

    @Test
    void details_showsStepsAndMergeSettings() {
        when(catalog.find("pubmed_search")).thenReturn(Optional.of(definition));

        String output = inspectCommand.details("pubmed_search");

        assertThat(output).contains("Pipeline: ")
                .contains("Merge: last, declared order")
                .contains("search")
                .contains("GET")
                .contains("pubmed/esearch.fcgi")
                .contains("Params: {query=term}")
                .contains("Response transform: yes")
                .contains("On error: continue");
    }

    @Test
    void details_whenPipelineIsUnknown_printsError() {
        when(catalog.find("nope")).thenReturn(Optional.empty());

        assertThat(inspectCommand.details("nope")).contains("No pipeline named 'nope'.");
    }

    @Test
    void services_listsConfiguredServices() {
        ServiceConfig kakao = new ServiceConfig();
        kakao.setBaseUrl("https://dapi.kakao.com");
        kakao.getAuth().setType(AuthType.HEADER);
        ServiceConfig dataGoKr = new ServiceConfig();
        dataGoKr.setBaseUrl("https://apis.data.go.kr");
        dataGoKr.setResponseFormat(ResponseFormat.XML);
        Map<String, ServiceConfig> services = new LinkedHashMap<>();
        services.put("kakao", kakao);
        services.put("data-go-kr", dataGoKr);
        when(serviceRegistry.all()).thenReturn(services);

        String output = inspectCommand.services();

        assertThat(output).contains("Configured services:")
                .contains("https://dapi.kakao.com (auth: header, format: json)")
                .contains("https://apis.data.go.kr (auth: none, format: xml)");
    }

    @Test
    void services_whenNoneConfigured_saysSo() {
        when(serviceRegistry.all()).thenReturn(Map.of());

        assertThat(inspectCommand.services()).contains("No services configured");
    }
}
