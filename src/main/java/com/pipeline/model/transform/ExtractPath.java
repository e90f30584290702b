package com.pipeline.model.transform;

/**
 * The {@code extract} stage's address: either a path string or a bare array index.
 */
public interface ExtractPath {

    /**
     * A dotted/bracketed path such as {@code response.body.items[0]}.
     */
    record Key(String path) implements ExtractPath {
    }

    /**
     * A bare integer, shorthand for indexing into the top-level array.
     */
    record Index(int index) implements ExtractPath {
    }
}
