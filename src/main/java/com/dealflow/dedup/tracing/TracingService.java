package com.dealflow.dedup.tracing;

import com.dealflow.dedup.core.model.DetectionOperation;
import com.dealflow.dedup.core.model.EntityKind;

/**
 * Starts spans for detector operations.
 */
public interface TracingService {

    Span startSpan(DetectionOperation operation);

    /**
     * Starts a span tagged with the kind of entity being compared.
     */
    Span startSpan(DetectionOperation operation, EntityKind kind);
}
