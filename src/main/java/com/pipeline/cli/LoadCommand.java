package com.pipeline.cli;

import com.pipeline.dto.response.CommandResponse;
import com.pipeline.exception.PipelineConfigurationException;
import com.pipeline.model.PipelineDefinition;
import com.pipeline.service.api.PipelineCatalog;
import com.pipeline.service.api.PipelineDefinitionParser;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.File;

/**
 * Loads a pipeline definition file into the catalog.
 */
@ShellComponent
public class LoadCommand {

    private final PipelineDefinitionParser parser;
    private final PipelineCatalog catalog;

    public LoadCommand(PipelineDefinitionParser parser, PipelineCatalog catalog) {
        this.parser = parser;
        this.catalog = catalog;
    }

    /**
     * @param filePath path to a YAML or JSON definition
     * @param name     catalog name overriding the one in the document
     */
    @ShellMethod(key = "load", value = "Load a pipeline definition from a YAML or JSON file.")
    public String load(
            @ShellOption(value = {"--file", "-f"}, help = "Path to the definition file.") String filePath,
            @ShellOption(value = {"--name", "-n"}, help = "Name to register the pipeline under.", defaultValue = ShellOption.NULL) String name
    ) {
        File file = new File(filePath);
        if (!file.isFile()) {
            return new CommandResponse(false, "File not found: " + filePath).toAnsiString();
        }
        try {
            PipelineDefinition definition = parser.parse(file);
            if (name != null && !name.isBlank()) {
                definition = definition.withName(name);
            }
            catalog.register(definition);
            return new CommandResponse(true, "Loaded pipeline '" + definition.name() + "' with "
                    + definition.steps().size() + " step(s).").toAnsiString();
        } catch (PipelineConfigurationException e) {
            return new CommandResponse(false, "Invalid pipeline definition: " + e.getMessage()).toAnsiString();
        }
    }
}
