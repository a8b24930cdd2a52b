package com.dealflow.dedup.core.model;

import java.util.Objects;

/**
 * A candidate duplicate found by one strategy.
 * {@code similarityScore} currently mirrors {@code confidence}; both lie in [0,1].
 */
public record MatchCandidate(
        String matchedEntityId,
        ComparableRecord matchedRecord,
        double similarityScore,
        double confidence,
        StrategyType strategy,
        SimilarityFactors factors,
        String reasoning
) {
    public MatchCandidate {
        Objects.requireNonNull(matchedEntityId, "matchedEntityId is required");
        Objects.requireNonNull(strategy, "strategy is required");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if (Double.isNaN(similarityScore) || similarityScore < 0.0 || similarityScore > 1.0) {
            throw new IllegalArgumentException("Similarity score must be between 0.0 and 1.0, got " + similarityScore);
        }
        factors = factors != null ? factors : SimilarityFactors.empty();
        reasoning = reasoning != null ? reasoning : "";
    }

    /**
     * Creates a candidate whose similarity score equals its confidence.
     */
    public static MatchCandidate of(ComparableRecord matched, double confidence, StrategyType strategy,
                                    SimilarityFactors factors, String reasoning) {
        return new MatchCandidate(matched.getId(), matched, confidence, confidence, strategy, factors, reasoning);
    }
}
