package com.dealflow.dedup.audit;

import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.StrategyType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of the detection log for one entity kind.
 *
 * @param entityKind          the kind the entries belong to
 * @param totalDetections     number of logged pairs
 * @param countsByStatus      entries per review status, every status present
 * @param averageConfidence   mean confidence over all entries, 0 when there are none
 * @param veryHighConfidence  entries at or above {@value #VERY_HIGH_CONFIDENCE}
 * @param highConfidence      entries in [{@value #HIGH_CONFIDENCE}, {@value #VERY_HIGH_CONFIDENCE})
 * @param strategyBreakdown   usage per strategy, most used first
 */
public record DetectionStatistics(
        EntityKind entityKind,
        long totalDetections,
        Map<DetectionLogStatus, Long> countsByStatus,
        double averageConfidence,
        long veryHighConfidence,
        long highConfidence,
        List<StrategyUsage> strategyBreakdown
) {

    public static final double VERY_HIGH_CONFIDENCE = 0.95;
    public static final double HIGH_CONFIDENCE = 0.85;

    public DetectionStatistics {
        Map<DetectionLogStatus, Long> counts = new EnumMap<>(DetectionLogStatus.class);
        for (DetectionLogStatus status : DetectionLogStatus.values()) {
            counts.put(status, 0L);
        }
        if (countsByStatus != null) {
            counts.putAll(countsByStatus);
        }
        countsByStatus = Collections.unmodifiableMap(counts);
        strategyBreakdown = strategyBreakdown != null ? List.copyOf(strategyBreakdown) : List.of();
    }

    public long count(DetectionLogStatus status) {
        return countsByStatus.get(status);
    }

    public static DetectionStatistics empty(EntityKind entityKind) {
        return new DetectionStatistics(entityKind, 0, null, 0.0, 0, 0, null);
    }

    /**
     * How often one strategy produced a logged pair.
     */
    public record StrategyUsage(StrategyType strategy, long usageCount, double averageConfidence) {
    }
}
