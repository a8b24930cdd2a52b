package com.dealflow.dedup.strategy;

import com.dealflow.dedup.api.DetectionConfig;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.SimilarityFactor;
import com.dealflow.dedup.core.model.SimilarityFactors;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.similarity.FuzzyStringMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches on fuzzy similarity of both names.
 * Each name must reach the medium fuzzy threshold and their average the high one.
 * Company names are compared without stripping legal suffixes here.
 */
public class FuzzyNameStrategy implements DuplicateStrategy {

    private final FuzzyStringMatcher fuzzyMatcher;
    private final double perFieldThreshold;
    private final double averageThreshold;

    public FuzzyNameStrategy(FuzzyStringMatcher fuzzyMatcher, DetectionConfig config) {
        this.fuzzyMatcher = fuzzyMatcher;
        this.perFieldThreshold = config.getFuzzyMediumThreshold();
        this.averageThreshold = config.getFuzzyHighThreshold();
    }

    @Override
    public StrategyType type() {
        return StrategyType.FUZZY_NAME;
    }

    @Override
    public List<MatchCandidate> findMatches(ComparableRecord record, List<ComparableRecord> candidates) {
        List<MatchCandidate> matches = new ArrayList<>();

        for (ComparableRecord existing : candidates) {
            double dealNameScore = fuzzyMatcher.similarity(record.getDealName(), existing.getDealName());
            double customerScore = fuzzyMatcher.similarity(record.getCustomerName(), existing.getCustomerName());
            double average = (dealNameScore + customerScore) / 2;

            if (dealNameScore >= perFieldThreshold
                    && customerScore >= perFieldThreshold
                    && average >= averageThreshold) {
                SimilarityFactors factors = SimilarityFactors.builder()
                        .put(SimilarityFactor.DEAL_NAME, dealNameScore / 100)
                        .put(SimilarityFactor.CUSTOMER_NAME, customerScore / 100)
                        .build();
                String reasoning = String.format(Locale.ROOT,
                        "Fuzzy match: deal name %.1f%%, customer %.1f%%", dealNameScore, customerScore);
                matches.add(MatchCandidate.of(existing, average / 100, type(), factors, reasoning));
            }
        }
        return matches;
    }
}
