package com.dealflow.dedup.core.model;

/**
 * Lifecycle status of a duplicate cluster.
 * The engine only ever creates {@link #ACTIVE} clusters; the other states are
 * set by whoever administers stored clusters.
 */
public enum ClusterStatus {
    ACTIVE,
    MERGED,
    SPLIT
}
