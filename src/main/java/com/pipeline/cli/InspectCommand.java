package com.pipeline.cli;

import com.pipeline.dto.response.CommandResponse;
import com.pipeline.model.AuthType;
import com.pipeline.model.PipelineDefinition;
import com.pipeline.model.PipelineStep;
import com.pipeline.model.ServiceConfig;
import com.pipeline.service.api.PipelineCatalog;
import com.pipeline.service.api.ServiceRegistry;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only views of the pipeline catalog and the configured services.
 */
@ShellComponent
public class InspectCommand {

    // ANSI escape codes for coloring the output
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private final PipelineCatalog catalog;
    private final ServiceRegistry serviceRegistry;

    public InspectCommand(PipelineCatalog catalog, ServiceRegistry serviceRegistry) {
        this.catalog = catalog;
        this.serviceRegistry = serviceRegistry;
    }

    @ShellMethod(key = "pipelines", value = "List loaded pipelines.")
    public String pipelines() {
        if (catalog.list().isEmpty()) {
            return ANSI_YELLOW + "No pipelines loaded. Use the 'load' command first." + ANSI_RESET;
        }
        StringBuilder out = new StringBuilder(ANSI_CYAN + "Loaded pipelines:" + ANSI_RESET);
        for (PipelineDefinition definition : catalog.list()) {
            out.append("\n  ").append(ANSI_GREEN).append(definition.name()).append(ANSI_RESET)
                    .append(" (").append(definition.steps().size()).append(" steps, ")
                    .append(definition.merge().mode().name().toLowerCase()).append(")");
            if (!definition.description().isBlank()) {
                out.append(" - ").append(definition.description());
            }
        }
        return out.toString();
    }

    /**
     * Shows the steps of one pipeline with their services, endpoints and failure policies.
     *
     * @param name the pipeline to inspect
     */
    @ShellMethod(key = "pipeline-details", value = "Show the steps and merge settings of a pipeline.")
    public String details(@ShellOption(value = {"--name", "-n"}, help = "The pipeline to inspect.") String name) {
        Optional<PipelineDefinition> found = catalog.find(name);
        if (found.isEmpty()) {
            return new CommandResponse(false, "No pipeline named '" + name + "'.").toAnsiString();
        }
        PipelineDefinition definition = found.get();
        StringBuilder out = new StringBuilder();
        out.append(ANSI_CYAN).append("Pipeline: ").append(ANSI_YELLOW).append(definition.name()).append(ANSI_RESET);
        if (!definition.description().isBlank()) {
            out.append("\n  ").append(definition.description());
        }
        out.append("\n  Merge: ").append(definition.merge().mode().name().toLowerCase())
                .append(definition.merge().sourceTag() ? ", source-tagged" : "")
                .append(definition.merge().wrap().isPresent() ? ", wrapped" : "")
                .append(definition.merge().preserveDeclaredOrder() ? ", declared order" : "");
        for (PipelineStep step : definition.steps()) {
            out.append("\n").append("-".repeat(50));
            out.append("\n").append(ANSI_GREEN).append("Step: ").append(ANSI_YELLOW).append(step.getId()).append(ANSI_RESET);
            out.append("\n  ").append(ANSI_PURPLE).append(step.getMethod()).append(ANSI_RESET)
                    .append(" ").append(step.getService()).append(step.getEndpoint());
            out.append("\n  On error: ").append(step.getOnError().name().toLowerCase());
            if (!step.getParamMap().isEmpty()) {
                out.append("\n  Params: ").append(step.getParamMap());
            }
            if (step.getResponse() != null) {
                out.append("\n  Response transform: yes");
            }
        }
        return out.toString();
    }

    @ShellMethod(key = "services", value = "List configured backend services.")
    public String services() {
        Map<String, ServiceConfig> services = serviceRegistry.all();
        if (services.isEmpty()) {
            return ANSI_YELLOW + "No services configured under 'pipeline.services'." + ANSI_RESET;
        }
        StringBuilder out = new StringBuilder(ANSI_CYAN + "Configured services:" + ANSI_RESET);
        services.forEach((name, service) -> {
            AuthType authType = service.getAuth() != null && service.getAuth().getType() != null
                    ? service.getAuth().getType()
                    : AuthType.NONE;
            out.append("\n  ").append(ANSI_GREEN).append(name).append(ANSI_RESET)
                    .append(" ").append(service.getBaseUrl())
                    .append(" (auth: ").append(authType.name().toLowerCase())
                    .append(", format: ").append(service.getResponseFormat().name().toLowerCase()).append(")");
        });
        return out.toString();
    }
}
