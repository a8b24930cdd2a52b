package com.dealflow.dedup.metrics;

import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.core.model.SuggestedAction;

import java.time.Duration;

/**
 * Records duplicate detection metrics.
 * The default {@link NoOpMetricsService} does nothing, so detectors work
 * without a meter registry.
 */
public interface MetricsService {

    void recordDetectionDuration(SuggestedAction action, Duration duration);

    void recordMatchCount(int matches);

    void recordTopConfidence(double confidence);

    void incrementStrategyMatches(StrategyType strategy, int matches);

    void recordBatchSize(int size);

    void incrementClustersFound(int clusters);

    /**
     * Counts a best-effort side effect (detection log, notification) that failed.
     */
    void incrementSideEffectFailure(String sideEffect);
}
