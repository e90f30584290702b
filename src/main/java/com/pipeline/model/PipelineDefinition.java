package com.pipeline.model;

import java.util.List;

/**
 * A named, reusable pipeline as loaded from a definition file.
 *
 * @param name        catalog key
 * @param description free text shown by {@code pipeline-details}
 * @param steps       the decoded step list, in declared order
 * @param merge       the decoded merge block
 */
public record PipelineDefinition(String name, String description, List<PipelineStep> steps, MergeConfig merge) {

    public PipelineDefinition {
        steps = List.copyOf(steps);
    }

    public PipelineDefinition withName(String newName) {
        return new PipelineDefinition(newName, description, steps, merge);
    }
}
