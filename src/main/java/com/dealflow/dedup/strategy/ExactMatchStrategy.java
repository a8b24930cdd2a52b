package com.dealflow.dedup.strategy;

import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.SimilarityFactor;
import com.dealflow.dedup.core.model.SimilarityFactors;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.rules.RecordNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches records whose normalized deal name and normalized company name are identical.
 * When both sides carry a deal value the amounts must also agree to within one unit.
 */
public class ExactMatchStrategy implements DuplicateStrategy {

    private static final double VALUE_EPSILON = 1.0;
    private static final String REASONING = "Exact match on deal name and customer name";

    private static final SimilarityFactors EXACT_FACTORS = SimilarityFactors.builder()
            .put(SimilarityFactor.DEAL_NAME, 1.0)
            .put(SimilarityFactor.CUSTOMER_NAME, 1.0)
            .put(SimilarityFactor.DEAL_VALUE, 1.0)
            .build();

    @Override
    public StrategyType type() {
        return StrategyType.EXACT_MATCH;
    }

    @Override
    public List<MatchCandidate> findMatches(ComparableRecord record, List<ComparableRecord> candidates) {
        List<MatchCandidate> matches = new ArrayList<>();

        String dealName = RecordNormalizer.normalizeString(record.getDealName());
        String customer = RecordNormalizer.normalizeCompanyName(record.getCustomerName());
        // Two records with blank names carry no evidence of being the same deal
        if (dealName.isEmpty() || customer.isEmpty()) {
            return matches;
        }

        for (ComparableRecord existing : candidates) {
            if (!dealName.equals(RecordNormalizer.normalizeString(existing.getDealName()))
                    || !customer.equals(RecordNormalizer.normalizeCompanyName(existing.getCustomerName()))) {
                continue;
            }
            if (record.hasDealValue() && existing.hasDealValue()
                    && Math.abs(record.getDealValue() - existing.getDealValue()) >= VALUE_EPSILON) {
                continue;
            }
            matches.add(MatchCandidate.of(existing, 1.0, type(), EXACT_FACTORS, REASONING));
        }
        return matches;
    }
}
