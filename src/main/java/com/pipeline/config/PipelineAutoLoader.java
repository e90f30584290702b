package com.pipeline.config;

import com.pipeline.model.PipelineDefinition;
import com.pipeline.service.api.PipelineCatalog;
import com.pipeline.service.api.PipelineDefinitionParser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Loads every pipeline definition found in the definitions directory into the catalog at startup.
 * <p>
 * The directory comes from {@code PIPELINE_DEFINITIONS_DIR} and defaults to {@code /app/pipelines}.
 * Files ending in {@code .yml}, {@code .yaml} or {@code .json} are read in name order; a file that
 * fails to parse is reported and skipped.
 */
@Component
@Profile("!test")
public class PipelineAutoLoader implements CommandLineRunner {

    @Value("${PIPELINE_DEFINITIONS_DIR:/app/pipelines}")
    private String definitionsDirectoryPath;

    private final PipelineDefinitionParser parser;
    private final PipelineCatalog catalog;

    public PipelineAutoLoader(PipelineDefinitionParser parser, PipelineCatalog catalog) {
        this.parser = parser;
        this.catalog = catalog;
    }

    @Override
    public void run(String... args) {
        System.out.println("\n--- Loading pipeline definitions ---");
        File definitionsDir = new File(definitionsDirectoryPath);

        if (!definitionsDir.isDirectory()) {
            System.out.println("Definitions directory not found at '" + definitionsDirectoryPath + "'. Skipping.");
            System.out.println("--- Loading complete ---\n");
            return;
        }

        File[] files = definitionsDir.listFiles((dir, name) -> isDefinitionFile(name));
        if (files == null || files.length == 0) {
            System.out.println("No pipeline definitions (.yml, .yaml, .json) found in '" + definitionsDirectoryPath + "'. Skipping.");
            System.out.println("--- Loading complete ---\n");
            return;
        }

        Arrays.sort(files, Comparator.comparing(File::getName));
        int loaded = 0;
        for (File file : files) {
            try {
                PipelineDefinition definition = parser.parse(file);
                catalog.register(definition);
                loaded++;
                System.out.println("  [LOAD] '" + definition.name() + "' (" + definition.steps().size() + " steps) from " + file.getName());
            } catch (Exception e) {
                System.err.println("  [LOAD] FAILED: Could not load '" + file.getName() + "'. Error: " + e.getMessage());
            }
        }
        System.out.println("--- Loaded " + loaded + " of " + files.length + " pipeline definitions ---\n");
    }

    static boolean isDefinitionFile(String name) {
        String lower = name.toLowerCase();
        return lower.endsWith(".yml") || lower.endsWith(".yaml") || lower.endsWith(".json");
    }
}
