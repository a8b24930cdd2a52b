package com.dealflow.dedup.audit;

/**
 * Review state of a logged detection.
 */
public enum DetectionLogStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    REJECTED("rejected"),
    AUTO_MERGED("auto_merged");

    private final String tag;

    DetectionLogStatus(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
