package com.dealflow.dedup.strategy;

import com.dealflow.dedup.api.DetectionConfig;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.SimilarityScore;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.similarity.FieldWeights;
import com.dealflow.dedup.similarity.WeightedSimilarityScorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches on the weighted average of every field factor.
 * Uses the configured default weights and the medium confidence threshold.
 */
public class MultiFactorStrategy implements DuplicateStrategy {

    private final WeightedSimilarityScorer scorer;
    private final FieldWeights weights;
    private final double threshold;

    public MultiFactorStrategy(WeightedSimilarityScorer scorer, DetectionConfig config) {
        this.scorer = scorer;
        this.weights = config.getDefaultWeights();
        this.threshold = config.getMediumConfidenceThreshold();
    }

    @Override
    public StrategyType type() {
        return StrategyType.MULTI_FACTOR;
    }

    @Override
    public List<MatchCandidate> findMatches(ComparableRecord record, List<ComparableRecord> candidates) {
        List<MatchCandidate> matches = new ArrayList<>();

        for (ComparableRecord existing : candidates) {
            SimilarityScore similarity = scorer.score(record, existing, weights);
            if (similarity.overall() >= threshold) {
                String reasoning = String.format(Locale.ROOT,
                        "Multi-factor match with %.1f%% overall similarity", similarity.overall() * 100);
                matches.add(MatchCandidate.of(existing, similarity.overall(), type(),
                        similarity.factors(), reasoning));
            }
        }
        return matches;
    }
}
