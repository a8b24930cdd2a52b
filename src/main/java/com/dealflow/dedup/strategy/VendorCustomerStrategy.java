package com.dealflow.dedup.strategy;

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
 * Matches records registered under the same vendor for a similar customer.
 * The shared vendor contributes a fixed bonus; deal-name similarity adds a little on top.
 */
public class VendorCustomerStrategy implements DuplicateStrategy {

    static final double CUSTOMER_THRESHOLD = 0.80;
    private static final double VENDOR_BONUS = 0.3;
    private static final double CUSTOMER_WEIGHT = 0.5;
    private static final double DEAL_NAME_WEIGHT = 0.2;

    private final FieldSimilarity fieldSimilarity;

    public VendorCustomerStrategy(FieldSimilarity fieldSimilarity) {
        this.fieldSimilarity = fieldSimilarity;
    }

    @Override
    public StrategyType type() {
        return StrategyType.VENDOR_CUSTOMER;
    }

    @Override
    public List<MatchCandidate> findMatches(ComparableRecord record, List<ComparableRecord> candidates) {
        List<MatchCandidate> matches = new ArrayList<>();
        if (!record.hasVendorId()) {
            return matches;
        }

        for (ComparableRecord existing : candidates) {
            if (!record.getVendorId().equals(existing.getVendorId())) {
                continue;
            }

            double customerSim = fieldSimilarity.customerNameSimilarity(
                    record.getCustomerName(), existing.getCustomerName());
            if (customerSim < CUSTOMER_THRESHOLD) {
                continue;
            }

            double dealNameSim = fieldSimilarity.dealNameSimilarity(record.getDealName(), existing.getDealName());
            double confidence = Math.min(1.0,
                    VENDOR_BONUS + customerSim * CUSTOMER_WEIGHT + dealNameSim * DEAL_NAME_WEIGHT);

            SimilarityFactors factors = SimilarityFactors.builder()
                    .put(SimilarityFactor.VENDOR_MATCH, 1.0)
                    .put(SimilarityFactor.CUSTOMER_NAME, customerSim)
                    .put(SimilarityFactor.DEAL_NAME, dealNameSim)
                    .build();
            String reasoning = String.format(Locale.ROOT,
                    "Same vendor with similar customer (%.1f%%)", customerSim * 100);
            matches.add(MatchCandidate.of(existing, confidence, type(), factors, reasoning));
        }
        return matches;
    }
}
