package com.dealflow.dedup.core.model;

/**
 * Action suggested for a detection result, derived from its top confidence.
 */
public enum SuggestedAction {
    /**
     * Top confidence at or above the auto-merge threshold (0.95 by default).
     * Safe to merge without human review.
     */
    AUTO_MERGE("auto_merge"),

    /**
     * Top confidence at or above the high confidence threshold (0.85 by default).
     */
    MANUAL_REVIEW("manual_review"),

    /**
     * No match strong enough to act on.
     */
    NO_ACTION("no_action");

    private final String tag;

    SuggestedAction(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
