package com.pipeline.model;

/**
 * Wire format of a service's response body.
 */
public enum ResponseFormat {
    JSON,
    XML,
    RAW;

    public static ResponseFormat fromValue(String value) {
        if ("xml".equalsIgnoreCase(value)) {
            return XML;
        }
        if ("raw".equalsIgnoreCase(value)) {
            return RAW;
        }
        return JSON;
    }
}
