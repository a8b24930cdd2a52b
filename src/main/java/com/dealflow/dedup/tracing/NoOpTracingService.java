package com.dealflow.dedup.tracing;

import com.dealflow.dedup.core.model.DetectionOperation;
import com.dealflow.dedup.core.model.EntityKind;

/**
 * Used when no tracer is configured. All spans are one shared instance that drops everything.
 */
public class NoOpTracingService implements TracingService {

    static final Span DISCARDING_SPAN = new DiscardingSpan();

    @Override
    public Span startSpan(DetectionOperation operation) {
        return DISCARDING_SPAN;
    }

    @Override
    public Span startSpan(DetectionOperation operation, EntityKind kind) {
        return DISCARDING_SPAN;
    }

    private static final class DiscardingSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, double value) {
        }

        @Override
        public void succeed() {
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void close() {
        }
    }
}
