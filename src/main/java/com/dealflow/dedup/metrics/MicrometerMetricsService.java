package com.dealflow.dedup.metrics;

import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.core.model.SuggestedAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code duplicate.detection.duration} Timer (tag: action)</li>
 *   <li>{@code duplicate.detection.matches} DistributionSummary</li>
 *   <li>{@code duplicate.detection.confidence} DistributionSummary</li>
 *   <li>{@code duplicate.strategy.matches} Counter (tag: strategy)</li>
 *   <li>{@code duplicate.batch.size} DistributionSummary</li>
 *   <li>{@code duplicate.clusters.found} Counter</li>
 *   <li>{@code duplicate.side_effect.failures} Counter (tag: sideEffect)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<SuggestedAction, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary matchCountSummary;
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter clustersCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.matchCountSummary = DistributionSummary.builder("duplicate.detection.matches")
                .description("Number of matches returned per detection")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("duplicate.detection.confidence")
                .description("Top match confidence per detection with matches")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("duplicate.batch.size")
                .description("Number of records per batch detection")
                .register(registry);
        this.clustersCounter = Counter.builder("duplicate.clusters.found")
                .description("Number of duplicate clusters built")
                .register(registry);
    }

    @Override
    public void recordDetectionDuration(SuggestedAction action, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(action, a ->
                Timer.builder("duplicate.detection.duration")
                        .description("Duration of single-record duplicate detection")
                        .tag("action", a.getTag())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordMatchCount(int matches) {
        matchCountSummary.record(matches);
    }

    @Override
    public void recordTopConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementStrategyMatches(StrategyType strategy, int matches) {
        if (matches <= 0) {
            return;
        }
        String key = "strategy:" + strategy.getTag();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("duplicate.strategy.matches")
                        .description("Raw matches produced by each strategy before aggregation")
                        .tag("strategy", strategy.getTag())
                        .register(registry));
        counter.increment(matches);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementClustersFound(int clusters) {
        clustersCounter.increment(clusters);
    }

    @Override
    public void incrementSideEffectFailure(String sideEffect) {
        String key = "sideEffect:" + sideEffect;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("duplicate.side_effect.failures")
                        .description("Best-effort side effects that failed and were skipped")
                        .tag("sideEffect", sideEffect)
                        .register(registry));
        counter.increment();
    }
}
