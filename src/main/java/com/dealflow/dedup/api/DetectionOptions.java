package com.dealflow.dedup.api;

import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.StrategyType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-call options for single-record detection.
 *
 * <p>When {@code candidates} is set the pool is used as given and no detection log
 * or notification is produced. When it is absent the pool comes from the record
 * repository. A null {@code threshold} means the configured minimum match threshold;
 * an explicit threshold, zero included, is used as is.</p>
 */
public class DetectionOptions {

    private static final DetectionOptions DEFAULTS = builder().build();

    private final List<ComparableRecord> candidates;
    private final Double threshold;
    private final Set<StrategyType> strategies;
    private final EntityKind entityKind;

    private DetectionOptions(Builder builder) {
        this.candidates = builder.candidates != null ? List.copyOf(builder.candidates) : null;
        this.threshold = builder.threshold;
        this.strategies = builder.strategies != null ? Set.copyOf(builder.strategies) : null;
        this.entityKind = builder.entityKind;
    }

    public static DetectionOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Options that compare against the given pool only.
     */
    public static DetectionOptions against(List<ComparableRecord> candidates) {
        return builder().candidates(candidates).build();
    }

    public boolean hasCandidates() {
        return candidates != null;
    }

    /**
     * The explicit pool, or null when the repository should be queried.
     */
    public List<ComparableRecord> getCandidates() {
        return candidates;
    }

    /**
     * The explicit threshold, or null for the configured default.
     */
    public Double getThreshold() {
        return threshold;
    }

    /**
     * The enabled strategies, or null for all of them.
     */
    public Set<StrategyType> getStrategies() {
        return strategies;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public Builder toBuilder() {
        Builder builder = new Builder().entityKind(entityKind);
        builder.candidates = candidates;
        builder.threshold = threshold;
        builder.strategies = strategies;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<ComparableRecord> candidates;
        private Double threshold;
        private Set<StrategyType> strategies;
        private EntityKind entityKind = EntityKind.DEAL;

        public Builder candidates(List<ComparableRecord> candidates) {
            this.candidates = candidates;
            return this;
        }

        public Builder threshold(double threshold) {
            if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder strategies(Set<StrategyType> strategies) {
            this.strategies = strategies;
            return this;
        }

        public Builder strategies(StrategyType first, StrategyType... rest) {
            this.strategies = EnumSet.of(first, rest);
            return this;
        }

        public Builder entityKind(EntityKind entityKind) {
            if (entityKind == null) {
                throw new IllegalArgumentException("entityKind is required");
            }
            this.entityKind = entityKind;
            return this;
        }

        public DetectionOptions build() {
            return new DetectionOptions(this);
        }
    }
}
