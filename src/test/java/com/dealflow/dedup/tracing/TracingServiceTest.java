package com.dealflow.dedup.tracing;

import com.dealflow.dedup.core.model.DetectionOperation;
import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.SuggestedAction;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @ParameterizedTest
    @DisplayName("Operations map to duplicate.* span names")
    @CsvSource({
            "DETECT, duplicate.detect",
            "BATCH, duplicate.batch",
            "CLUSTER, duplicate.cluster"
    })
    void spanNames(DetectionOperation operation, String expected) {
        assertEquals(expected, operation.spanName());
    }

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Every operation shares the discarding span")
        void sharedSpan() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertSame(NoOpTracingService.DISCARDING_SPAN, noOp.startSpan(DetectionOperation.BATCH));
            assertSame(NoOpTracingService.DISCARDING_SPAN,
                    noOp.startSpan(DetectionOperation.DETECT, EntityKind.VENDOR));
        }

        @Test
        @DisplayName("A full detection lifecycle is silently ignored")
        void lifecycleIgnored() {
            assertDoesNotThrow(() -> {
                try (Span span = new NoOpTracingService().startSpan(DetectionOperation.DETECT, EntityKind.DEAL)) {
                    span.setAttribute("candidates", 12L);
                    span.recordVerdict(2, 0.97, SuggestedAction.AUTO_MERGE);
                    span.fail(new IllegalStateException("lookup failed"));
                }
            });
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    @ExtendWith(MockitoExtension.class)
    class OTelTests {

        @Mock
        private Tracer tracer;

        @Mock
        private SpanBuilder spanBuilder;

        @Mock
        private io.opentelemetry.api.trace.Span otelSpan;

        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
            when(spanBuilder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Detection span carries the entity kind and the verdict")
        void detectionSpan() {
            try (Span span = service.startSpan(DetectionOperation.DETECT, EntityKind.DEAL)) {
                span.setAttribute("candidates", 3L);
                span.recordVerdict(1, 0.9, SuggestedAction.MANUAL_REVIEW);
                span.succeed();
            }

            verify(tracer).spanBuilder("duplicate.detect");
            verify(spanBuilder).setSpanKind(SpanKind.INTERNAL);
            verify(spanBuilder).setAttribute("dedup.entityKind", "deal");
            verify(otelSpan).setAttribute("dedup.candidates", 3L);
            verify(otelSpan).setAttribute("dedup.matches", 1L);
            verify(otelSpan).setAttribute("dedup.topConfidence", 0.9);
            verify(otelSpan).setAttribute("dedup.action", "manual_review");
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Failure records the exception and an error status")
        void failedSpan() {
            IllegalStateException failure = new IllegalStateException("store down");

            Span span = service.startSpan(DetectionOperation.BATCH);
            span.fail(failure);
            span.close();

            verify(otelSpan).recordException(failure);
            verify(otelSpan).setStatus(StatusCode.ERROR, "IllegalStateException");
            verify(otelSpan).end();
            verify(spanBuilder, never()).setAttribute(eq("dedup.entityKind"), anyString());
        }
    }
}
