package com.dealflow.dedup.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A connected group of records linked by high-confidence duplicate matches.
 *
 * <p>The cluster key is derived from the sorted member ids, so the same
 * membership always yields the same key regardless of discovery order.</p>
 */
public record DuplicateCluster(
        String clusterId,
        String clusterKey,
        EntityKind entityKind,
        List<String> memberIds,
        double confidenceScore,
        Instant createdAt,
        ClusterStatus status
) {
    public static final String KEY_SEPARATOR = "|";

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    public DuplicateCluster {
        Objects.requireNonNull(clusterId, "clusterId is required");
        Objects.requireNonNull(entityKind, "entityKind is required");
        Objects.requireNonNull(status, "status is required");
        if (memberIds == null || memberIds.size() < 2) {
            throw new IllegalArgumentException("A cluster needs at least 2 members");
        }
        memberIds = List.copyOf(memberIds);
        if (clusterKey == null) {
            clusterKey = keyFor(memberIds);
        }
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("Confidence score must be between 0.0 and 1.0");
        }
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /**
     * Creates an active cluster with a fresh id and sorted members.
     */
    public static DuplicateCluster active(EntityKind kind, Collection<String> members, double confidenceScore) {
        List<String> sorted = new ArrayList<>(members);
        Collections.sort(sorted);
        return new DuplicateCluster(generateClusterId(), keyFor(sorted), kind, sorted,
                confidenceScore, Instant.now(), ClusterStatus.ACTIVE);
    }

    /**
     * Deterministic key: member ids sorted and joined by {@value #KEY_SEPARATOR}.
     */
    public static String keyFor(Collection<String> memberIds) {
        List<String> sorted = new ArrayList<>(memberIds);
        Collections.sort(sorted);
        return String.join(KEY_SEPARATOR, sorted);
    }

    /**
     * Generates ids of the form {@code cluster_<epochMillis>_<9 random chars>}.
     */
    public static String generateClusterId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "cluster_" + System.currentTimeMillis() + "_" + suffix;
    }

    public int clusterSize() {
        return memberIds.size();
    }

    public boolean contains(String entityId) {
        return memberIds.contains(entityId);
    }
}
