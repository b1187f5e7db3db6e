package com.knowledge.fusion.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Character n-gram Jaccard similarity.
 * Computes |intersection| / |union| of the lower-cased n-gram sets.
 * A string shorter than n contributes itself as its only gram.
 */
public class NGramJaccardSimilarity implements SimilarityAlgorithm {

    private static final int DEFAULT_N = 2;

    private final int n;

    public NGramJaccardSimilarity() {
        this(DEFAULT_N);
    }

    public NGramJaccardSimilarity(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1");
        }
        this.n = n;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        Set<String> grams1 = grams(s1);
        Set<String> grams2 = grams(s2);

        int intersectionSize = 0;
        for (String gram : grams1) {
            if (grams2.contains(gram)) {
                intersectionSize++;
            }
        }
        int unionSize = grams1.size() + grams2.size() - intersectionSize;
        return unionSize == 0 ? 0.0 : (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return n + "-gram Jaccard";
    }

    private Set<String> grams(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        Set<String> result = new HashSet<>();
        if (lower.length() < n) {
            result.add(lower);
            return result;
        }
        for (int i = 0; i + n <= lower.length(); i++) {
            result.add(lower.substring(i, i + n));
        }
        return result;
    }
}
