package com.pipeline.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.config.PipelineProperties;
import com.pipeline.exception.PipelineConfigurationException;
import com.pipeline.model.MergeConfig;
import com.pipeline.model.MergeMode;
import com.pipeline.model.OnError;
import com.pipeline.model.PipelineStep;
import com.pipeline.model.StepOutcome;
import com.pipeline.service.api.PipelineOrchestrator;
import com.pipeline.service.api.StepExecutor;
import com.pipeline.transform.JsonValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs pipelines either in parallel or in declared order and hands the outcomes to the
 * {@link MergeEngine}.
 * <p>
 * A pipeline runs in order when its merge mode is {@code sequential} or when any step refers to
 * another step's output; otherwise every step is submitted to a worker pool created for the run.
 * Parallel outcomes are recorded as steps finish.
 */
@Service
@Slf4j
public class PipelineOrchestratorImpl implements PipelineOrchestrator {

    private final StepExecutor stepExecutor;
    private final ReferenceResolver referenceResolver;
    private final MergeEngine mergeEngine;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PipelineOrchestratorImpl(StepExecutor stepExecutor,
                                    ReferenceResolver referenceResolver,
                                    MergeEngine mergeEngine,
                                    PipelineProperties properties) {
        this.stepExecutor = stepExecutor;
        this.referenceResolver = referenceResolver;
        this.mergeEngine = mergeEngine;
        this.properties = properties;
    }

    @Override
    public JsonNode run(JsonNode pipeline, JsonNode merge, Map<String, Object> input) {
        List<PipelineStep> steps;
        MergeConfig mergeConfig;
        try {
            steps = PipelineConfigDecoder.decodeSteps(pipeline);
            mergeConfig = PipelineConfigDecoder.decodeMerge(merge);
        } catch (PipelineConfigurationException e) {
            log.warn("Rejected pipeline definition: {}", e.getMessage());
            return JsonValues.error(e.getMessage());
        }
        return run(steps, mergeConfig, input);
    }

    @Override
    public JsonNode run(List<PipelineStep> steps, MergeConfig merge, Map<String, Object> input) {
        if (steps == null || steps.isEmpty()) {
            return JsonValues.error(PipelineConfigDecoder.EMPTY_PIPELINE);
        }
        Set<String> ids = new HashSet<>();
        for (PipelineStep step : steps) {
            if (!ids.add(step.getId())) {
                return JsonValues.error("Duplicate step id: " + step.getId());
            }
        }
        MergeConfig mergeConfig = merge != null ? merge : MergeConfig.DEFAULT;
        JsonNode inputNode = input != null ? objectMapper.valueToTree(input) : objectMapper.createObjectNode();

        boolean sequential = mergeConfig.mode() == MergeMode.SEQUENTIAL || referenceResolver.hasReferences(steps);
        log.info("Running {} step(s) {} (merge: {})", steps.size(), sequential ? "sequentially" : "in parallel",
                mergeConfig.mode().name().toLowerCase());

        List<StepOutcome> outcomes = sequential
                ? runSequential(steps, inputNode)
                : runParallel(steps, inputNode);

        if (mergeConfig.preserveDeclaredOrder()) {
            outcomes.sort(Comparator.comparingInt(StepOutcome::index));
        }
        return mergeEngine.merge(outcomes, mergeConfig, inputNode);
    }

    private List<StepOutcome> runSequential(List<PipelineStep> steps, JsonNode input) {
        List<StepOutcome> outcomes = new ArrayList<>();
        Map<String, JsonNode> stepOutputs = new LinkedHashMap<>();
        Map<String, JsonNode> visibleOutputs = Collections.unmodifiableMap(stepOutputs);

        for (int i = 0; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            StepOutcome outcome = runStep(step, i, input, visibleOutputs);
            outcomes.add(outcome);
            if (outcome.success()) {
                stepOutputs.put(step.getId(), outcome.data());
            } else if (step.getOnError() == OnError.STOP) {
                log.warn("Step '{}' failed, halting pipeline", step.getId());
                break;
            }
        }
        return outcomes;
    }

    private List<StepOutcome> runParallel(List<PipelineStep> steps, JsonNode input) {
        int poolSize = Math.max(1, Math.min(steps.size(), properties.getWorkerPoolCap()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<StepOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<StepOutcome>, Integer> submitted = new HashMap<>();
        List<StepOutcome> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < steps.size(); i++) {
                PipelineStep step = steps.get(i);
                int index = i;
                submitted.put(completion.submit(() -> runStep(step, index, input, Map.of())), index);
            }
            for (int i = 0; i < steps.size(); i++) {
                Future<StepOutcome> done = completion.take();
                try {
                    outcomes.add(done.get());
                } catch (ExecutionException e) {
                    int index = submitted.get(done);
                    PipelineStep step = steps.get(index);
                    log.error("Step '{}' failed unexpectedly", step.getId(), e.getCause());
                    outcomes.add(StepOutcome.of(step, index, JsonValues.error(messageOf(e.getCause()))));
                }
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for pipeline steps; merging {} finished outcome(s)", outcomes.size());
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdown();
        }
        return outcomes;
    }

    /**
     * Runs one step and normalizes any exception into an error outcome.
     */
    private StepOutcome runStep(PipelineStep step, int index, JsonNode input, Map<String, JsonNode> stepOutputs) {
        log.info("Executing step '{}' on service '{}'", step.getId(), step.getService());
        StepOutcome outcome;
        try {
            outcome = StepOutcome.of(step, index, stepExecutor.execute(step, input, stepOutputs));
        } catch (RuntimeException e) {
            log.error("Step '{}' threw while executing", step.getId(), e);
            outcome = StepOutcome.of(step, index, JsonValues.error(messageOf(e)));
        }
        if (outcome.success()) {
            log.info("Step '{}' succeeded", step.getId());
        } else {
            log.info("Step '{}' failed: {}", step.getId(), outcome.data().path("error").asText());
        }
        return outcome;
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
