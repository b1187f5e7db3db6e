package com.knowledge.fusion.similarity;

/**
 * Interface for string similarity algorithms.
 * Implementations are pure and symmetric: {@code compute(a, b) == compute(b, a)},
 * and always return a score between 0.0 (no similarity) and 1.0 (identical).
 * A null or empty operand scores 0.0 unless the implementation documents otherwise
 * ({@link ContextSimilarity} treats two snippets without keywords as identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
