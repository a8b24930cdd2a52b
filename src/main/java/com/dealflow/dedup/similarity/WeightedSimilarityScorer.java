package com.dealflow.dedup.similarity;

import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.SimilarityFactor;
import com.dealflow.dedup.core.model.SimilarityFactors;
import com.dealflow.dedup.core.model.SimilarityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Computes every field factor for a pair of records and combines them as
 * {@code sum(factor * weight) / sum(weight)}. A zero total weight yields 0.
 */
public class WeightedSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(WeightedSimilarityScorer.class);

    private final FieldSimilarity fieldSimilarity;

    public WeightedSimilarityScorer() {
        this(new FieldSimilarity());
    }

    public WeightedSimilarityScorer(FieldSimilarity fieldSimilarity) {
        this.fieldSimilarity = fieldSimilarity;
    }

    public SimilarityScore score(ComparableRecord a, ComparableRecord b) {
        return score(a, b, FieldWeights.defaultWeights());
    }

    public SimilarityScore score(ComparableRecord a, ComparableRecord b, FieldWeights weights) {
        SimilarityFactors factors = computeFactors(a, b);

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<SimilarityFactor, Double> entry : factors.asMap().entrySet()) {
            double weight = weights.weightOf(entry.getKey());
            weightedSum += entry.getValue() * weight;
            totalWeight += weight;
        }

        double overall = totalWeight > 0 ? weightedSum / totalWeight : 0.0;
        // Guard against rounding pushing the ratio past 1
        overall = Math.min(1.0, Math.max(0.0, overall));

        log.trace("Weighted score for '{}' vs '{}': overall={}, {}",
                a.getId(), b.getId(), overall, factors);
        return new SimilarityScore(overall, factors, totalWeight);
    }

    /**
     * Computes all seven factors for the pair.
     */
    public SimilarityFactors computeFactors(ComparableRecord a, ComparableRecord b) {
        boolean sameVendor = a.hasVendorId() && b.hasVendorId() && a.getVendorId().equals(b.getVendorId());
        return SimilarityFactors.builder()
                .put(SimilarityFactor.DEAL_NAME, fieldSimilarity.dealNameSimilarity(a.getDealName(), b.getDealName()))
                .put(SimilarityFactor.CUSTOMER_NAME,
                        fieldSimilarity.customerNameSimilarity(a.getCustomerName(), b.getCustomerName()))
                .put(SimilarityFactor.VENDOR_MATCH, sameVendor ? 1.0 : 0.0)
                .put(SimilarityFactor.DEAL_VALUE, fieldSimilarity.valueSimilarity(a.getDealValue(), b.getDealValue()))
                .put(SimilarityFactor.CLOSE_DATE, fieldSimilarity.dateSimilarity(a.getCloseDate(), b.getCloseDate()))
                .put(SimilarityFactor.PRODUCTS, fieldSimilarity.productSimilarity(a.getProducts(), b.getProducts()))
                .put(SimilarityFactor.CONTACTS, fieldSimilarity.contactSimilarity(a.getContacts(), b.getContacts()))
                .build();
    }

    public FieldSimilarity getFieldSimilarity() {
        return fieldSimilarity;
    }
}
