package com.dealflow.dedup.metrics;

import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.core.model.SuggestedAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordDetectionDuration(SuggestedAction.AUTO_MERGE, Duration.ofMillis(100));
                noOp.recordMatchCount(3);
                noOp.recordTopConfidence(0.97);
                noOp.incrementStrategyMatches(StrategyType.FUZZY_NAME, 2);
                noOp.recordBatchSize(50);
                noOp.incrementClustersFound(4);
                noOp.incrementSideEffectFailure("webhook");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record detection duration as timer tagged by action")
        void recordDetectionDuration() {
            metrics.recordDetectionDuration(SuggestedAction.MANUAL_REVIEW, Duration.ofMillis(150));
            metrics.recordDetectionDuration(SuggestedAction.MANUAL_REVIEW, Duration.ofMillis(250));
            metrics.recordDetectionDuration(SuggestedAction.NO_ACTION, Duration.ofMillis(10));

            Timer timer = registry.find("duplicate.detection.duration")
                    .tag("action", "manual_review")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
        }

        @Test
        @DisplayName("Should count strategy matches per strategy tag")
        void strategyMatches() {
            metrics.incrementStrategyMatches(StrategyType.EXACT_MATCH, 2);
            metrics.incrementStrategyMatches(StrategyType.EXACT_MATCH, 3);
            metrics.incrementStrategyMatches(StrategyType.MULTI_FACTOR, 0);

            Counter counter = registry.find("duplicate.strategy.matches")
                    .tag("strategy", "exact_match")
                    .counter();

            assertNotNull(counter);
            assertEquals(5.0, counter.count());
            assertNull(registry.find("duplicate.strategy.matches").tag("strategy", "multi_factor").counter());
        }

        @Test
        @DisplayName("Should record match counts and top confidence as summaries")
        void summaries() {
            metrics.recordMatchCount(2);
            metrics.recordMatchCount(0);
            metrics.recordTopConfidence(0.9);
            metrics.recordBatchSize(25);

            DistributionSummary matches = registry.find("duplicate.detection.matches").summary();
            DistributionSummary confidence = registry.find("duplicate.detection.confidence").summary();
            DistributionSummary batch = registry.find("duplicate.batch.size").summary();

            assertEquals(2, matches.count());
            assertEquals(2.0, matches.totalAmount());
            assertEquals(0.9, confidence.totalAmount(), 1e-9);
            assertEquals(25.0, batch.totalAmount());
        }

        @Test
        @DisplayName("Should count clusters and side-effect failures")
        void counters() {
            metrics.incrementClustersFound(3);
            metrics.incrementSideEffectFailure("webhook");
            metrics.incrementSideEffectFailure("webhook");
            metrics.incrementSideEffectFailure("detection_log");

            assertEquals(3.0, registry.find("duplicate.clusters.found").counter().count());
            assertEquals(2.0, registry.find("duplicate.side_effect.failures")
                    .tag("sideEffect", "webhook").counter().count());
            assertEquals(1.0, registry.find("duplicate.side_effect.failures")
                    .tag("sideEffect", "detection_log").counter().count());
        }
    }
}
