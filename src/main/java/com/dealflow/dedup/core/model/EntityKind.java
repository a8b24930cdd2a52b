package com.dealflow.dedup.core.model;

/**
 * Kinds of records the duplicate detection engine can compare.
 * Deals are the reference shape; vendors and contacts share the same tags in
 * detection logs and clusters.
 */
public enum EntityKind {
    DEAL("deal"),
    VENDOR("vendor"),
    CONTACT("contact");

    private final String tag;

    EntityKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
