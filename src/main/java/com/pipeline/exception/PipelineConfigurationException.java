package com.pipeline.exception;

/**
 * Signals a pipeline definition that cannot be decoded: a step list that is missing or not a
 * list, duplicate step ids, or a block of the wrong shape.
 * <p>
 * It is raised only while configuration is being decoded. Once a pipeline runs, failures are
 * reported as {@code {"error": ...}} values instead of exceptions.
 */
public class PipelineConfigurationException extends RuntimeException {

    /**
     * @param message what is wrong with the definition, phrased for the operator who wrote it
     */
    public PipelineConfigurationException(String message) {
        super(message);
    }

    /**
     * @param message what is wrong with the definition
     * @param cause   the underlying parse failure
     */
    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
