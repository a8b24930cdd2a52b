package com.dealflow.dedup.core.model;

/**
 * Identifies the matching heuristic that produced a {@link MatchCandidate}.
 */
public enum StrategyType {
    /**
     * Normalized deal and customer names are identical, values within one unit.
     */
    EXACT_MATCH("exact_match"),

    /**
     * Fuzzy deal and customer names both similar, average high.
     */
    FUZZY_NAME("fuzzy_name"),

    /**
     * Same customer with a deal value inside tolerance.
     */
    CUSTOMER_VALUE("customer_value"),

    /**
     * Same customer with a close date inside tolerance.
     */
    CUSTOMER_DATE("customer_date"),

    /**
     * Same vendor with a similar customer.
     */
    VENDOR_CUSTOMER("vendor_customer"),

    /**
     * Weighted score across every field.
     */
    MULTI_FACTOR("multi_factor");

    private final String tag;

    StrategyType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
