package com.dealflow.dedup.metrics;

import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.core.model.SuggestedAction;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDetectionDuration(SuggestedAction action, Duration duration) {
    }

    @Override
    public void recordMatchCount(int matches) {
    }

    @Override
    public void recordTopConfidence(double confidence) {
    }

    @Override
    public void incrementStrategyMatches(StrategyType strategy, int matches) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementClustersFound(int clusters) {
    }

    @Override
    public void incrementSideEffectFailure(String sideEffect) {
    }
}
