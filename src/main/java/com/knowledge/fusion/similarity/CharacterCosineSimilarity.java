package com.knowledge.fusion.similarity;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Cosine similarity of lower-cased character frequency vectors.
 * Counts are integral, so the dot product and norms are exact and the score is symmetric.
 */
public class CharacterCosineSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        Map<Character, Integer> freq1 = frequencies(s1);
        Map<Character, Integer> freq2 = frequencies(s2);

        long dot = 0;
        for (Map.Entry<Character, Integer> entry : freq1.entrySet()) {
            Integer other = freq2.get(entry.getKey());
            if (other != null) {
                dot += (long) entry.getValue() * other;
            }
        }

        double norm = Math.sqrt(squaredNorm(freq1)) * Math.sqrt(squaredNorm(freq2));
        if (norm == 0.0) {
            return 0.0;
        }
        return Math.min(1.0, dot / norm);
    }

    @Override
    public String getName() {
        return "Cosine";
    }

    private static Map<Character, Integer> frequencies(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        Map<Character, Integer> freq = new HashMap<>();
        for (int i = 0; i < lower.length(); i++) {
            freq.merge(lower.charAt(i), 1, Integer::sum);
        }
        return freq;
    }

    private static long squaredNorm(Map<Character, Integer> freq) {
        long sum = 0;
        for (int count : freq.values()) {
            sum += (long) count * count;
        }
        return sum;
    }
}
