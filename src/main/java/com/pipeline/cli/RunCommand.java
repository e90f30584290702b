package com.pipeline.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.cli.ui.JsonColorizer;
import com.pipeline.cli.ui.Spinner;
import com.pipeline.dto.request.RunPipelineRequest;
import com.pipeline.dto.response.CommandResponse;
import com.pipeline.model.MergeConfig;
import com.pipeline.model.PipelineDefinition;
import com.pipeline.service.api.PipelineCatalog;
import com.pipeline.service.api.PipelineOrchestrator;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.Map;
import java.util.Optional;

/**
 * Runs a loaded pipeline against a JSON input and prints the merged result.
 */
@ShellComponent
public class RunCommand {

    private final PipelineCatalog catalog;
    private final PipelineOrchestrator orchestrator;
    private final Spinner spinner;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RunCommand(PipelineCatalog catalog, PipelineOrchestrator orchestrator, Spinner spinner) {
        this.catalog = catalog;
        this.orchestrator = orchestrator;
        this.spinner = spinner;
    }

    /**
     * Executes a pipeline from the catalog.
     *
     * @param name          the pipeline name, as listed by {@code pipelines}
     * @param input         the caller input as a JSON object, e.g. {@code {"query":"pizza"}}
     * @param verbose       raise logging to DEBUG while the pipeline runs
     * @param preserveOrder merge step outcomes in declared order instead of completion order
     * @return the colorized result, or a red error message
     */
    @ShellMethod(key = "run", value = "Run a loaded pipeline with a JSON input.")
    public String run(
            @ShellOption(value = {"--name", "-n"}, help = "The pipeline to run.") String name,
            @ShellOption(value = {"--input", "-i"}, help = "Input as a JSON object.", defaultValue = "{}") String input,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose,
            @ShellOption(value = {"--preserve-order"}, help = "Merge results in declared step order.", defaultValue = "false", arity = 0) boolean preserveOrder
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }
        try {
            Optional<PipelineDefinition> definition = catalog.find(name);
            if (definition.isEmpty()) {
                return new CommandResponse(false, "No pipeline named '" + name + "'. Use the 'load' command first.").toAnsiString();
            }

            RunPipelineRequest request;
            try {
                request = new RunPipelineRequest(name, objectMapper.readValue(input, new TypeReference<Map<String, Object>>() {}), preserveOrder);
            } catch (JsonProcessingException e) {
                return new CommandResponse(false, "Input must be a JSON object: " + e.getOriginalMessage()).toAnsiString();
            }

            PipelineDefinition pipeline = definition.get();
            MergeConfig merge = request.preserveOrder()
                    ? pipeline.merge().withPreserveDeclaredOrder(true)
                    : pipeline.merge();
            JsonNode result = spinner.spin("Running " + name + "...",
                    () -> orchestrator.run(pipeline.steps(), merge, request.input()));
            return JsonColorizer.colorize(result);
        } catch (Exception e) {
            return new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }
}
