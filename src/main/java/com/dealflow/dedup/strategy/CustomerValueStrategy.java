package com.dealflow.dedup.strategy;

import com.dealflow.dedup.api.DetectionConfig;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.SimilarityFactor;
import com.dealflow.dedup.core.model.SimilarityFactors;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.similarity.FieldSimilarity;

import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches the same customer with a similar deal value.
 * Records without a deal value on either side are skipped.
 */
public class CustomerValueStrategy implements DuplicateStrategy {

    private static final double CUSTOMER_WEIGHT = 0.6;
    private static final double VALUE_WEIGHT = 0.4;

    private final FieldSimilarity fieldSimilarity;
    private final double threshold;

    public CustomerValueStrategy(FieldSimilarity fieldSimilarity, DetectionConfig config) {
        this.fieldSimilarity = fieldSimilarity;
        this.threshold = config.getHighConfidenceThreshold();
    }

    @Override
    public StrategyType type() {
        return StrategyType.CUSTOMER_VALUE;
    }

    @Override
    public List<MatchCandidate> findMatches(ComparableRecord record, List<ComparableRecord> candidates) {
        List<MatchCandidate> matches = new ArrayList<>();
        if (!record.hasDealValue()) {
            return matches;
        }

        NumberFormat amountFormat = NumberFormat.getNumberInstance(Locale.US);
        for (ComparableRecord existing : candidates) {
            if (!existing.hasDealValue()) {
                continue;
            }

            double customerSim = fieldSimilarity.customerNameSimilarity(
                    record.getCustomerName(), existing.getCustomerName());
            double valueSim = fieldSimilarity.valueSimilarity(record.getDealValue(), existing.getDealValue());

            if (customerSim >= threshold && valueSim >= threshold) {
                double confidence = customerSim * CUSTOMER_WEIGHT + valueSim * VALUE_WEIGHT;
                SimilarityFactors factors = SimilarityFactors.builder()
                        .put(SimilarityFactor.CUSTOMER_NAME, customerSim)
                        .put(SimilarityFactor.DEAL_VALUE, valueSim)
                        .build();
                String reasoning = String.format(Locale.ROOT,
                        "Same customer (%.1f%%) with similar deal value ($%s vs $%s)",
                        customerSim * 100,
                        amountFormat.format(record.getDealValue()),
                        amountFormat.format(existing.getDealValue()));
                matches.add(MatchCandidate.of(existing, Math.min(1.0, confidence), type(), factors, reasoning));
            }
        }
        return matches;
    }
}
