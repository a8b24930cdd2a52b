package com.dealflow.dedup.similarity;

/**
 * Best ratio of the shorter string against any equal-length window of the longer.
 * A string contained in the other scores 100.
 */
public class PartialRatio implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        if (longer.contains(shorter)) {
            return 100.0;
        }

        int window = shorter.length();
        double best = 0.0;
        for (int start = 0; start + window <= longer.length(); start++) {
            double score = LevenshteinRatio.rawRatio(shorter, longer.substring(start, start + window));
            if (score > best) {
                best = score;
            }
        }
        return Math.round(100.0 * best);
    }

    @Override
    public String getName() {
        return "PartialRatio";
    }
}
