package com.pipeline.model;

/**
 * What a sequential pipeline does after a step fails.
 */
public enum OnError {
    /** Halt the pipeline; a concat merge returns this step's error payload. */
    STOP,
    /** Skip the failed step and carry on. */
    CONTINUE;

    public static OnError fromValue(String value) {
        return "continue".equalsIgnoreCase(value) ? CONTINUE : STOP;
    }
}
