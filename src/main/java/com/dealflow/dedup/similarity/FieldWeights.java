package com.dealflow.dedup.similarity;

import com.dealflow.dedup.core.model.SimilarityFactor;

/**
 * Per-factor weights for multi-factor scoring.
 * A zero weight removes the factor from both the weighted sum and the total.
 * Weights need not sum to 1; the scorer divides by their total.
 */
public record FieldWeights(
        double dealName,
        double customerName,
        double vendorMatch,
        double dealValue,
        double closeDate,
        double products,
        double contacts
) {
    public FieldWeights {
        if (dealName < 0 || customerName < 0 || vendorMatch < 0 || dealValue < 0
                || closeDate < 0 || products < 0 || contacts < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
    }

    /**
     * Default deal weights, summing to 1.0.
     */
    public static FieldWeights defaultWeights() {
        return new FieldWeights(0.25, 0.25, 0.15, 0.15, 0.10, 0.05, 0.05);
    }

    /**
     * Weights that only look at the two names.
     */
    public static FieldWeights namesOnly() {
        return new FieldWeights(0.5, 0.5, 0, 0, 0, 0, 0);
    }

    public double weightOf(SimilarityFactor factor) {
        return switch (factor) {
            case DEAL_NAME -> dealName;
            case CUSTOMER_NAME -> customerName;
            case VENDOR_MATCH -> vendorMatch;
            case DEAL_VALUE -> dealValue;
            case CLOSE_DATE -> closeDate;
            case PRODUCTS -> products;
            case CONTACTS -> contacts;
        };
    }

    public double total() {
        return dealName + customerName + vendorMatch + dealValue + closeDate + products + contacts;
    }
}
