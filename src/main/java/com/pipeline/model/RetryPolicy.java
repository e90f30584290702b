package com.pipeline.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Retry settings for a service or a single step.
 * <p>
 * Lombok's {@code @Data} keeps this bindable from {@code application.yml}.
 */
@Data
public class RetryPolicy {

    /**
     * Total number of attempts, the first one included.
     */
    private int maxAttempts = 3;

    /**
     * {@code exponential} doubles the delay after every attempt, {@code fixed} keeps it constant.
     */
    private String backoff = "exponential";

    /**
     * Base delay between attempts, in seconds.
     */
    private double delay = 1.0;

    /**
     * HTTP status codes worth another attempt.
     */
    private List<Integer> retryOn = new ArrayList<>(List.of(429, 500, 502, 503, 504));

    public boolean isExponential() {
        return !"fixed".equalsIgnoreCase(backoff);
    }
}
