package com.dealflow.dedup.core.model;

/**
 * Weighted similarity between two records.
 *
 * @param overall weighted average of the factors, in [0,1]
 * @param factors the individual factor scores
 * @param weight  sum of the weights that were applied
 */
public record SimilarityScore(
        double overall,
        SimilarityFactors factors,
        double weight
) {
    @Override
    public String toString() {
        return String.format("SimilarityScore{overall=%.4f, weight=%.2f, factors=%s}",
                overall, weight, factors.toKeyedMap());
    }
}
