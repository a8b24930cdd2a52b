package com.dealflow.dedup.core.model;

/**
 * Per-field comparison dimensions used by the scorer and reported on matches.
 */
public enum SimilarityFactor {
    DEAL_NAME("dealName"),
    CUSTOMER_NAME("customerName"),
    VENDOR_MATCH("vendorMatch"),
    DEAL_VALUE("dealValue"),
    CLOSE_DATE("closeDate"),
    PRODUCTS("products"),
    CONTACTS("contacts");

    private final String key;

    SimilarityFactor(String key) {
        this.key = key;
    }

    /**
     * Key used when factors are serialized (detection log, events).
     */
    public String getKey() {
        return key;
    }
}
