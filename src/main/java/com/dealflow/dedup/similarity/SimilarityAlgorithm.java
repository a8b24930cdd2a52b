package com.dealflow.dedup.similarity;

/**
 * Interface for fuzzy string comparison algorithms.
 * Implementations return a score between 0 (no similarity) and 100 (identical)
 * and must be symmetric in their arguments.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two already normalized strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0 and 100
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
