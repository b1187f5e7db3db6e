package com.knowledge.fusion.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combined string score.
 * Formula: score = w1*editDistance + w2*bigramJaccard + w3*cosine + w4*lcs.
 * Exact equality short-circuits to 1.0; a null or empty operand to 0.0 (checked first).
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final LevenshteinSimilarity editDistance;
    private final NGramJaccardSimilarity nGram;
    private final CharacterCosineSimilarity cosine;
    private final LcsSimilarity lcs;
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.editDistance = new LevenshteinSimilarity();
        this.nGram = new NGramJaccardSimilarity();
        this.cosine = new CharacterCosineSimilarity();
        this.lcs = new LcsSimilarity();
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        SimilarityBreakdown breakdown = computeWithBreakdown(s1, s2);
        log.debug("Similarity scores for '{}' vs '{}': edit={}, ngram={}, cosine={}, lcs={}, combined={}",
                s1, s2, breakdown.editDistanceScore(), breakdown.nGramScore(),
                breakdown.cosineScore(), breakdown.lcsScore(), breakdown.combinedScore());
        return breakdown.combinedScore();
    }

    @Override
    public String getName() {
        return "Combined";
    }

    /**
     * Computes the per-algorithm breakdown of the combined score.
     */
    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        double editScore = editDistance.compute(s1, s2);
        double nGramScore = nGram.compute(s1, s2);
        double cosineScore = cosine.compute(s1, s2);
        double lcsScore = lcs.compute(s1, s2);
        double combined = weights.editDistanceWeight() * editScore
                + weights.nGramWeight() * nGramScore
                + weights.cosineWeight() * cosineScore
                + weights.lcsWeight() * lcsScore;

        return new SimilarityBreakdown(editScore, nGramScore, cosineScore, lcsScore,
                Math.max(0.0, Math.min(1.0, combined)), weights);
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    /**
     * Detailed breakdown of similarity scores from each algorithm.
     */
    public record SimilarityBreakdown(
            double editDistanceScore,
            double nGramScore,
            double cosineScore,
            double lcsScore,
            double combinedScore,
            SimilarityWeights weights
    ) {
        @Override
        public String toString() {
            return String.format(
                    "SimilarityBreakdown{edit=%.4f (w=%.2f), ngram=%.4f (w=%.2f), cosine=%.4f (w=%.2f), lcs=%.4f (w=%.2f), combined=%.4f}",
                    editDistanceScore, weights.editDistanceWeight(),
                    nGramScore, weights.nGramWeight(),
                    cosineScore, weights.cosineWeight(),
                    lcsScore, weights.lcsWeight(),
                    combinedScore
            );
        }
    }
}
