package com.dealflow.dedup.similarity;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity over sets of already normalized values.
 * Computes |intersection| / |union|; an empty side yields 0.
 */
public final class SetSimilarity {

    private SetSimilarity() {
        // Utility class
    }

    public static double jaccard(Collection<String> values1, Collection<String> values2) {
        if (values1 == null || values2 == null || values1.isEmpty() || values2.isEmpty()) {
            return 0.0;
        }

        Set<String> set1 = new HashSet<>(values1);
        Set<String> set2 = new HashSet<>(values2);

        // Count intersection without creating a copy
        int intersectionSize = 0;
        for (String value : set1) {
            if (set2.contains(value)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = set1.size() + set2.size() - intersectionSize;
        if (unionSize == 0) {
            return 0.0;
        }
        return (double) intersectionSize / unionSize;
    }
}
