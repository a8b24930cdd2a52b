package com.dealflow.dedup.cluster;

/**
 * How a cluster's confidence score is derived.
 */
public enum ClusterScoring {
    /**
     * Every cluster carries the configured placeholder confidence.
     */
    PLACEHOLDER,

    /**
     * Mean confidence of the match edges inside the cluster.
     */
    AVERAGE_EDGE
}
