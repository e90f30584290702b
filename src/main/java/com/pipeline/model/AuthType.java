package com.pipeline.model;

/**
 * How a service expects its credential.
 */
public enum AuthType {
    /** No credential. */
    NONE,
    /** The credential travels as a query parameter. */
    QUERY_PARAM,
    /** The credential travels in a single header, optionally prefixed. */
    HEADER,
    /** Several headers, each filled from its own secret. */
    HEADER_PAIR
}
