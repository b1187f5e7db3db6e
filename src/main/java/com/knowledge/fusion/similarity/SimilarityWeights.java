package com.knowledge.fusion.similarity;

/**
 * Weights for the combined string score.
 */
public record SimilarityWeights(
        double editDistanceWeight,
        double nGramWeight,
        double cosineWeight,
        double lcsWeight
) {
    public SimilarityWeights {
        if (editDistanceWeight < 0 || nGramWeight < 0 || cosineWeight < 0 || lcsWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = editDistanceWeight + nGramWeight + cosineWeight + lcsWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: 0.3 edit distance, 0.3 bigram Jaccard, 0.2 cosine, 0.2 LCS.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.3, 0.3, 0.2, 0.2);
    }

    /**
     * Weights favoring edit distance (good for typo detection).
     */
    public static SimilarityWeights editDistanceFocused() {
        return new SimilarityWeights(0.5, 0.2, 0.1, 0.2);
    }
}
