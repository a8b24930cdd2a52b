package com.dealflow.dedup.similarity;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ratio on token sets. Compares the shared tokens against each side's
 * shared-plus-remaining tokens, so extra words on one side are tolerated.
 */
public class TokenSetRatio implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }

        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);

        Set<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        Set<String> diff1to2 = new TreeSet<>(tokens1);
        diff1to2.removeAll(tokens2);
        Set<String> diff2to1 = new TreeSet<>(tokens2);
        diff2to1.removeAll(tokens1);

        String sortedIntersection = String.join(" ", intersection);
        String combined1to2 = (sortedIntersection + " " + String.join(" ", diff1to2)).trim();
        String combined2to1 = (sortedIntersection + " " + String.join(" ", diff2to1)).trim();

        double best = Math.max(
                Math.max(LevenshteinRatio.rawRatio(sortedIntersection, combined1to2),
                        LevenshteinRatio.rawRatio(sortedIntersection, combined2to1)),
                LevenshteinRatio.rawRatio(combined1to2, combined2to1));
        return Math.round(100.0 * best);
    }

    @Override
    public String getName() {
        return "TokenSetRatio";
    }

    private static Set<String> tokenize(String s) {
        Set<String> tokens = new TreeSet<>(Arrays.asList(s.trim().split("\\s+")));
        tokens.remove("");
        return tokens;
    }
}
