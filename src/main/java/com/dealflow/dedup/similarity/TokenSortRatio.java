package com.dealflow.dedup.similarity;

import java.util.Arrays;

/**
 * Ratio computed after sorting the whitespace-separated tokens of each string,
 * so word order does not matter.
 */
public class TokenSortRatio implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return Math.round(100.0 * LevenshteinRatio.rawRatio(sortTokens(s1), sortTokens(s2)));
    }

    @Override
    public String getName() {
        return "TokenSortRatio";
    }

    static String sortTokens(String s) {
        String[] tokens = s.trim().split("\\s+");
        Arrays.sort(tokens);
        return String.join(" ", tokens).trim();
    }
}
