package com.dealflow.dedup.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Per-field similarity scores in [0,1].
 * Fields that were not compared are absent rather than zero.
 */
public final class SimilarityFactors {

    private static final SimilarityFactors EMPTY = new SimilarityFactors(new EnumMap<>(SimilarityFactor.class));

    private final Map<SimilarityFactor, Double> scores;

    private SimilarityFactors(EnumMap<SimilarityFactor, Double> scores) {
        this.scores = Collections.unmodifiableMap(scores);
    }

    public static SimilarityFactors empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalDouble get(SimilarityFactor factor) {
        Double score = scores.get(factor);
        return score != null ? OptionalDouble.of(score) : OptionalDouble.empty();
    }

    public boolean contains(SimilarityFactor factor) {
        return scores.containsKey(factor);
    }

    public int size() {
        return scores.size();
    }

    public Map<SimilarityFactor, Double> asMap() {
        return scores;
    }

    /**
     * Returns the scores keyed by their serialized names, in factor order.
     */
    public Map<String, Double> toKeyedMap() {
        Map<String, Double> keyed = new LinkedHashMap<>();
        scores.forEach((factor, score) -> keyed.put(factor.getKey(), score));
        return keyed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return scores.equals(((SimilarityFactors) o).scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return "SimilarityFactors" + toKeyedMap();
    }

    public static class Builder {
        private final EnumMap<SimilarityFactor, Double> scores = new EnumMap<>(SimilarityFactor.class);

        public Builder put(SimilarityFactor factor, double score) {
            if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException(
                        "Factor " + factor.getKey() + " must be between 0.0 and 1.0, got " + score);
            }
            scores.put(factor, score);
            return this;
        }

        public SimilarityFactors build() {
            return new SimilarityFactors(new EnumMap<>(scores));
        }
    }
}
