package com.knowledge.fusion.similarity;

import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stateless facade over the string, structural and item-level similarity functions.
 * Every score is in [0, 1] and symmetric in its two arguments.
 */
public class SimilarityCalculator {
    private static final Logger log = LoggerFactory.getLogger(SimilarityCalculator.class);

    static final double ENTITY_NAME_WEIGHT = 0.4;
    static final double ENTITY_TYPE_WEIGHT = 0.3;
    static final double ENTITY_PROPERTIES_WEIGHT = 0.2;
    static final double ENTITY_ALIASES_WEIGHT = 0.1;

    static final double RELATION_TYPE_WEIGHT = 0.5;
    static final double RELATION_HEAD_WEIGHT = 0.25;
    static final double RELATION_TAIL_WEIGHT = 0.25;

    /**
     * Selectable string similarity algorithm.
     */
    public enum Method {
        LEVENSHTEIN,
        NGRAM_JACCARD,
        COSINE,
        LCS,
        COMBINED
    }

    private final SimilarityAlgorithm combined;
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final NGramJaccardSimilarity nGramJaccard = new NGramJaccardSimilarity();
    private final CharacterCosineSimilarity cosine = new CharacterCosineSimilarity();
    private final LcsSimilarity lcs = new LcsSimilarity();
    private final ContextSimilarity context = new ContextSimilarity();
    private final StructuralSimilarity structural;

    public SimilarityCalculator() {
        this(new CompositeSimilarityScorer());
    }

    /**
     * @param combined the algorithm used for {@link Method#COMBINED}, e.g. a
     *                 {@link CachingSimilarityAlgorithm} around a {@link CompositeSimilarityScorer}
     */
    public SimilarityCalculator(SimilarityAlgorithm combined) {
        this.combined = combined;
        this.structural = new StructuralSimilarity(combined);
    }

    public double stringSimilarity(String s1, String s2) {
        return combined.compute(s1, s2);
    }

    public double stringSimilarity(String s1, String s2, Method method) {
        return switch (method) {
            case LEVENSHTEIN -> levenshtein.compute(s1, s2);
            case NGRAM_JACCARD -> nGramJaccard.compute(s1, s2);
            case COSINE -> cosine.compute(s1, s2);
            case LCS -> lcs.compute(s1, s2);
            case COMBINED -> combined.compute(s1, s2);
        };
    }

    public double contextSimilarity(String context1, String context2) {
        return context.compute(context1, context2);
    }

    public double structuralSimilarity(Entity first, Entity second) {
        return structural.compute(first.getProperties(), second.getProperties());
    }

    /**
     * Weighted blend: name 0.4 (combined string score), type 0.3 (exact match only),
     * properties 0.2 (structural), aliases 0.1 (Jaccard; two empty alias sets score 0).
     */
    public double entitySimilarity(Entity first, Entity second) {
        double nameSimilarity = stringSimilarity(first.getName(), second.getName());
        double typeSimilarity = first.getType().equals(second.getType()) ? 1.0 : 0.0;
        double propertySimilarity = structural.compute(first.getProperties(), second.getProperties());
        double aliasSimilarity = jaccard(first.getAliases(), second.getAliases());

        double score = ENTITY_NAME_WEIGHT * nameSimilarity
                + ENTITY_TYPE_WEIGHT * typeSimilarity
                + ENTITY_PROPERTIES_WEIGHT * propertySimilarity
                + ENTITY_ALIASES_WEIGHT * aliasSimilarity;
        log.debug("Entity similarity '{}' vs '{}': name={}, type={}, properties={}, aliases={}, total={}",
                first.getName(), second.getName(), nameSimilarity, typeSimilarity,
                propertySimilarity, aliasSimilarity, score);
        return clamp(score);
    }

    /**
     * Weighted blend of string scores: type 0.5, head id 0.25, tail id 0.25.
     */
    public double relationSimilarity(Relation first, Relation second) {
        double score = RELATION_TYPE_WEIGHT * stringSimilarity(first.getType(), second.getType())
                + RELATION_HEAD_WEIGHT * stringSimilarity(first.getHeadEntityId(), second.getHeadEntityId())
                + RELATION_TAIL_WEIGHT * stringSimilarity(first.getTailEntityId(), second.getTailEntityId());
        return clamp(score);
    }

    /**
     * Ranks candidates by combined string score against a query.
     * Ties keep candidate order.
     */
    public List<ScoredCandidate> fuzzyMatch(String query, List<String> candidates, int topK) {
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (String candidate : candidates) {
            scored.add(new ScoredCandidate(candidate, stringSimilarity(query, candidate)));
        }
        return scored.stream()
                .sorted(Comparator.comparingDouble(ScoredCandidate::score).reversed())
                .limit(Math.max(0, topK))
                .collect(Collectors.toList());
    }

    /**
     * Symmetric pairwise matrix with 1.0 on the diagonal.
     */
    public double[][] similarityMatrix(List<String> items, Method method) {
        int n = items.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double similarity = stringSimilarity(items.get(i), items.get(j), method);
                matrix[i][j] = similarity;
                matrix[j][i] = similarity;
            }
        }
        return matrix;
    }

    /**
     * Seed-based duplicate groups (only groups with at least two members).
     */
    public List<List<Integer>> findDuplicates(List<String> items, double threshold) {
        double[][] matrix = similarityMatrix(items, Method.COMBINED);
        return SimilarityClustering.seedGroups(items.size(), (i, j) -> matrix[i][j] >= threshold)
                .stream()
                .filter(group -> group.size() > 1)
                .collect(Collectors.toList());
    }

    /**
     * Connected-components clustering: every item lands in exactly one cluster.
     */
    public List<List<Integer>> clusterBySimilarity(List<String> items, double threshold) {
        double[][] matrix = similarityMatrix(items, Method.COMBINED);
        return SimilarityClustering.connectedComponents(items.size(), (i, j) -> matrix[i][j] >= threshold);
    }

    static double jaccard(Set<String> first, Set<String> second) {
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        if (union.isEmpty()) {
            return 0.0;
        }
        int intersectionSize = first.size() + second.size() - union.size();
        return (double) intersectionSize / union.size();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * A candidate string with its score against a query.
     */
    public record ScoredCandidate(String candidate, double score) {
    }
}
