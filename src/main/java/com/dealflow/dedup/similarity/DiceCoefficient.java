package com.dealflow.dedup.similarity;

import java.util.HashMap;
import java.util.Map;

/**
 * Sørensen-Dice coefficient over character bigrams, scaled to 100.
 * Whitespace is ignored and repeated bigrams are counted with multiplicity.
 * The result is not rounded.
 */
public class DiceCoefficient implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String first = s1.replaceAll("\\s+", "");
        String second = s2.replaceAll("\\s+", "");

        if (first.equals(second)) {
            return first.isEmpty() ? 0.0 : 100.0;
        }
        if (first.length() < 2 || second.length() < 2) {
            return 0.0;
        }

        Map<String, Integer> firstBigrams = new HashMap<>();
        for (int i = 0; i < first.length() - 1; i++) {
            firstBigrams.merge(first.substring(i, i + 2), 1, Integer::sum);
        }

        int intersectionSize = 0;
        for (int i = 0; i < second.length() - 1; i++) {
            String bigram = second.substring(i, i + 2);
            int count = firstBigrams.getOrDefault(bigram, 0);
            if (count > 0) {
                firstBigrams.put(bigram, count - 1);
                intersectionSize++;
            }
        }

        return 100.0 * (2.0 * intersectionSize) / (first.length() + second.length() - 2);
    }

    @Override
    public String getName() {
        return "Dice";
    }
}
