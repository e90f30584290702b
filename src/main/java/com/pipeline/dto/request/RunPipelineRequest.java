package com.pipeline.dto.request;

import java.util.Map;

/**
 * Arguments of the {@code run} command once the input JSON has been parsed.
 *
 * @param name          catalog name of the pipeline
 * @param input         the caller input handed to every step
 * @param preserveOrder merge outcomes in declared step order
 */
public record RunPipelineRequest(String name, Map<String, Object> input, boolean preserveOrder) {
}
