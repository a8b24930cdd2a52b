package com.dealflow.dedup.similarity;

/**
 * Edit-distance ratio.
 * Uses an insert/delete distance (a substitution costs 2) so the score is
 * {@code 100 * (len1 + len2 - distance) / (len1 + len2)}, rounded to an integer.
 */
public class LevenshteinRatio implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        return Math.round(100.0 * rawRatio(s1, s2));
    }

    @Override
    public String getName() {
        return "Ratio";
    }

    /**
     * Unrounded ratio in [0,1]. Shared with the token and partial variants.
     */
    static double rawRatio(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int lengthSum = s1.length() + s2.length();
        int distance = indelDistance(s1, s2);
        return (double) (lengthSum - distance) / lengthSum;
    }

    /**
     * Edit distance where insertions and deletions cost 1 and a substitution costs 2,
     * so it equals {@code len1 + len2 - 2 * LCS}. Keeps one row sized to the shorter string.
     */
    static int indelDistance(String s1, String s2) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;
        int width = shorter.length();

        int[] row = new int[width + 1];
        for (int col = 0; col <= width; col++) {
            row[col] = col;
        }

        for (int line = 1; line <= longer.length(); line++) {
            char current = longer.charAt(line - 1);
            int diagonal = row[0];
            row[0] = line;
            for (int col = 1; col <= width; col++) {
                int above = row[col];
                int substitution = diagonal + (shorter.charAt(col - 1) == current ? 0 : 2);
                row[col] = Math.min(substitution, Math.min(above, row[col - 1]) + 1);
                diagonal = above;
            }
        }
        return row[width];
    }
}
