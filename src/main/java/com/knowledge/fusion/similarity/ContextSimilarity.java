package com.knowledge.fusion.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword-overlap similarity between two context snippets.
 *
 * <p>Keywords are lower-cased tokens split on anything that is not a letter or digit,
 * with stop words and single-character tokens removed. Runs of Han characters have no
 * word boundaries, so they contribute their character bigrams instead.
 * Two snippets without any keyword score 1.0; one empty side scores 0.0.</p>
 */
public class ContextSimilarity implements SimilarityAlgorithm {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Set<String> STOP_WORDS = Set.of(
            "的", "了", "在", "是", "我", "有", "和", "就", "不", "人", "都", "一",
            "个", "上", "也", "很", "到", "说", "要", "去", "你", "会", "着", "没有",
            "the", "of", "and", "in", "on", "at", "to", "is", "was", "an", "by", "for", "with"
    );

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> keywords1 = keywords(s1);
        Set<String> keywords2 = keywords(s2);

        if (keywords1.isEmpty() && keywords2.isEmpty()) {
            return 1.0;
        }
        if (keywords1.isEmpty() || keywords2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String keyword : keywords1) {
            if (keywords2.contains(keyword)) {
                intersectionSize++;
            }
        }
        int unionSize = keywords1.size() + keywords2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Context";
    }

    Set<String> keywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            if (containsHan(token)) {
                addHanBigrams(token, keywords);
            } else if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return keywords;
    }

    private static boolean containsHan(String token) {
        return token.codePoints().anyMatch(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.HAN);
    }

    private static void addHanBigrams(String token, Set<String> keywords) {
        if (token.length() < 2) {
            return;
        }
        for (int i = 0; i + 2 <= token.length(); i++) {
            String gram = token.substring(i, i + 2);
            if (!STOP_WORDS.contains(gram)) {
                keywords.add(gram);
            }
        }
    }
}
