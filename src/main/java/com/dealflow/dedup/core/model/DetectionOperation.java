package com.dealflow.dedup.core.model;

/**
 * Top-level detector operations. Used as the MDC operation value and to name spans.
 */
public enum DetectionOperation {
    DETECT("detect"),
    BATCH("batch"),
    CLUSTER("cluster");

    private static final String SPAN_PREFIX = "duplicate.";

    private final String tag;

    DetectionOperation(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public String spanName() {
        return SPAN_PREFIX + tag;
    }
}
