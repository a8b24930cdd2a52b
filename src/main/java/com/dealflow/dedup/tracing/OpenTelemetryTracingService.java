package com.dealflow.dedup.tracing;

import com.dealflow.dedup.core.model.DetectionOperation;
import com.dealflow.dedup.core.model.EntityKind;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * Emits detector spans through an OpenTelemetry {@link Tracer}.
 * Attribute keys get the {@code dedup.} prefix.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String ATTRIBUTE_PREFIX = "dedup.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(DetectionOperation operation) {
        return new DetectorSpan(builderFor(operation).startSpan());
    }

    @Override
    public Span startSpan(DetectionOperation operation, EntityKind kind) {
        SpanBuilder builder = builderFor(operation);
        builder.setAttribute(ATTRIBUTE_PREFIX + "entityKind", kind.getTag());
        return new DetectorSpan(builder.startSpan());
    }

    private SpanBuilder builderFor(DetectionOperation operation) {
        SpanBuilder builder = tracer.spanBuilder(operation.spanName());
        builder.setSpanKind(SpanKind.INTERNAL);
        return builder;
    }

    private static final class DetectorSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        DetectorSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void succeed() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable cause) {
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getClass().getSimpleName());
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
