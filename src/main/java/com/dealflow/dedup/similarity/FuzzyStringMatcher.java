package com.dealflow.dedup.similarity;

import com.dealflow.dedup.rules.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fuzzy matcher that takes the best score of several algorithms.
 * Inputs are normalized first; equal normalized values score 100.
 * Since every component is symmetric, so is the maximum.
 */
public class FuzzyStringMatcher implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(FuzzyStringMatcher.class);

    private final LevenshteinRatio ratio;
    private final PartialRatio partialRatio;
    private final TokenSortRatio tokenSortRatio;
    private final TokenSetRatio tokenSetRatio;
    private final DiceCoefficient dice;

    public FuzzyStringMatcher() {
        this.ratio = new LevenshteinRatio();
        this.partialRatio = new PartialRatio();
        this.tokenSortRatio = new TokenSortRatio();
        this.tokenSetRatio = new TokenSetRatio();
        this.dice = new DiceCoefficient();
    }

    /**
     * Normalizes both values and returns their similarity in [0,100].
     * A null or empty value on either side scores 0.
     */
    public double similarity(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return compute(RecordNormalizer.normalizeString(s1), RecordNormalizer.normalizeString(s2));
    }

    /**
     * Scores two values that are already normalized.
     */
    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 100.0;
        }
        return computeWithBreakdown(s1, s2).best();
    }

    @Override
    public String getName() {
        return "Fuzzy";
    }

    /**
     * Computes every component score for already normalized values.
     */
    public FuzzyBreakdown computeWithBreakdown(String s1, String s2) {
        FuzzyBreakdown breakdown = new FuzzyBreakdown(
                ratio.compute(s1, s2),
                partialRatio.compute(s1, s2),
                tokenSortRatio.compute(s1, s2),
                tokenSetRatio.compute(s1, s2),
                dice.compute(s1, s2));

        log.trace("Fuzzy scores for '{}' vs '{}': {}", s1, s2, breakdown);
        return breakdown;
    }

    /**
     * The algorithms consulted, in evaluation order.
     */
    public List<SimilarityAlgorithm> getAlgorithms() {
        return List.of(ratio, partialRatio, tokenSortRatio, tokenSetRatio, dice);
    }

    /**
     * Per-algorithm scores on the 0-100 scale.
     */
    public record FuzzyBreakdown(
            double ratio,
            double partialRatio,
            double tokenSortRatio,
            double tokenSetRatio,
            double dice
    ) {
        public double best() {
            return Math.max(Math.max(Math.max(ratio, partialRatio), Math.max(tokenSortRatio, tokenSetRatio)), dice);
        }

        @Override
        public String toString() {
            return String.format(
                    "FuzzyBreakdown{ratio=%.0f, partial=%.0f, tokenSort=%.0f, tokenSet=%.0f, dice=%.2f, best=%.2f}",
                    ratio, partialRatio, tokenSortRatio, tokenSetRatio, dice, best());
        }
    }
}
