package com.dealflow.dedup.audit;

import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.StrategyType;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted duplicate detection between two entities.
 * The pair is stored in canonical order, {@code entityId1 < entityId2}, so the same
 * pair detected from either side maps to one entry.
 */
public record DetectionLogEntry(
        String id,
        EntityKind entityKind,
        String entityId1,
        String entityId2,
        double similarityScore,
        double confidence,
        StrategyType strategy,
        String similarityFactors,
        DetectionLogStatus status,
        String detectedBy,
        Instant detectedAt
) {
    public DetectionLogEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(entityKind, "entityKind is required");
        Objects.requireNonNull(entityId1, "entityId1 is required");
        Objects.requireNonNull(entityId2, "entityId2 is required");
        Objects.requireNonNull(strategy, "strategy is required");
        if (entityId1.compareTo(entityId2) >= 0) {
            throw new IllegalArgumentException("entityId1 must sort before entityId2");
        }
        similarityFactors = similarityFactors != null ? similarityFactors : "{}";
        status = status != null ? status : DetectionLogStatus.PENDING;
        detectedAt = detectedAt != null ? detectedAt : Instant.now();
    }

    /**
     * Key identifying the pair regardless of detection direction.
     */
    public PairKey pairKey() {
        return new PairKey(entityKind, entityId1, entityId2);
    }

    public static Builder builder() {
        return new Builder();
    }

    public record PairKey(EntityKind entityKind, String entityId1, String entityId2) {
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private EntityKind entityKind = EntityKind.DEAL;
        private String entityId1;
        private String entityId2;
        private double similarityScore;
        private double confidence;
        private StrategyType strategy;
        private String similarityFactors;
        private DetectionLogStatus status = DetectionLogStatus.PENDING;
        private String detectedBy = "system";
        private Instant detectedAt = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityKind(EntityKind entityKind) {
            this.entityKind = entityKind;
            return this;
        }

        /**
         * Sets both entity ids, swapping them into canonical order if needed.
         */
        public Builder pair(String first, String second) {
            if (first.compareTo(second) <= 0) {
                this.entityId1 = first;
                this.entityId2 = second;
            } else {
                this.entityId1 = second;
                this.entityId2 = first;
            }
            return this;
        }

        public Builder similarityScore(double similarityScore) {
            this.similarityScore = similarityScore;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder strategy(StrategyType strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder similarityFactors(String similarityFactors) {
            this.similarityFactors = similarityFactors;
            return this;
        }

        public Builder status(DetectionLogStatus status) {
            this.status = status;
            return this;
        }

        public Builder detectedBy(String detectedBy) {
            this.detectedBy = detectedBy;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public DetectionLogEntry build() {
            return new DetectionLogEntry(id, entityKind, entityId1, entityId2, similarityScore, confidence,
                    strategy, similarityFactors, status, detectedBy, detectedAt);
        }
    }
}
