package com.dealflow.dedup.decision;

/**
 * Coarse confidence bucket of a match, used for reporting.
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW,
    NONE
}
