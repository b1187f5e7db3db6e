package com.knowledge.fusion.similarity;

/**
 * Longest-common-subsequence similarity: 2 * LCS(a, b) / (|a| + |b|). Case-sensitive.
 */
public class LcsSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int lcs = lcsLength(s1, s2);
        return (2.0 * lcs) / (s1.length() + s2.length());
    }

    @Override
    public String getName() {
        return "LCS";
    }

    static int lcsLength(String s1, String s2) {
        int m = s1.length();
        int n = s2.length();
        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];

        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] temp = previous;
            previous = current;
            current = temp;
        }
        return previous[n];
    }
}
