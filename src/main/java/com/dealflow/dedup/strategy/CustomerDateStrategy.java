package com.dealflow.dedup.strategy;

import com.dealflow.dedup.api.DetectionConfig;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.SimilarityFactor;
import com.dealflow.dedup.core.model.SimilarityFactors;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.similarity.FieldSimilarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches the same customer with a close date inside the date tolerance.
 */
public class CustomerDateStrategy implements DuplicateStrategy {

    private static final double CUSTOMER_WEIGHT = 0.6;
    private static final double DATE_WEIGHT = 0.4;

    private final FieldSimilarity fieldSimilarity;
    private final double threshold;

    public CustomerDateStrategy(FieldSimilarity fieldSimilarity, DetectionConfig config) {
        this.fieldSimilarity = fieldSimilarity;
        this.threshold = config.getHighConfidenceThreshold();
    }

    @Override
    public StrategyType type() {
        return StrategyType.CUSTOMER_DATE;
    }

    @Override
    public List<MatchCandidate> findMatches(ComparableRecord record, List<ComparableRecord> candidates) {
        List<MatchCandidate> matches = new ArrayList<>();
        if (record.getCloseDate() == null) {
            return matches;
        }

        for (ComparableRecord existing : candidates) {
            if (existing.getCloseDate() == null) {
                continue;
            }

            double customerSim = fieldSimilarity.customerNameSimilarity(
                    record.getCustomerName(), existing.getCustomerName());
            double dateSim = fieldSimilarity.dateSimilarity(record.getCloseDate(), existing.getCloseDate());

            if (customerSim >= threshold && dateSim >= threshold) {
                double confidence = customerSim * CUSTOMER_WEIGHT + dateSim * DATE_WEIGHT;
                SimilarityFactors factors = SimilarityFactors.builder()
                        .put(SimilarityFactor.CUSTOMER_NAME, customerSim)
                        .put(SimilarityFactor.CLOSE_DATE, dateSim)
                        .build();
                String reasoning = String.format(Locale.ROOT,
                        "Same customer (%.1f%%) with similar close date", customerSim * 100);
                matches.add(MatchCandidate.of(existing, Math.min(1.0, confidence), type(), factors, reasoning));
            }
        }
        return matches;
    }
}
