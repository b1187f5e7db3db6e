package com.knowledge.fusion.fusion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Summary of one fusion pass.
 *
 * @param sourceDistribution cluster size to number of results of that size
 * @param typeDistribution   fused item type to count, in first-seen order
 */
public record FusionStatistics(
        int totalFusions,
        int singleSourceFusions,
        int multiSourceFusions,
        double averageConfidence,
        int highConfidenceCount,
        int mediumConfidenceCount,
        int lowConfidenceCount,
        SortedMap<Integer, Integer> sourceDistribution,
        Map<String, Integer> typeDistribution
) {
    static final double HIGH_CONFIDENCE = 0.8;
    static final double MEDIUM_CONFIDENCE = 0.5;

    public FusionStatistics {
        sourceDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(sourceDistribution));
        typeDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(typeDistribution));
    }

    public static <T> FusionStatistics of(List<FusionResult<T>> results, Function<T, String> typeOf) {
        int single = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        double totalConfidence = 0.0;
        SortedMap<Integer, Integer> sources = new TreeMap<>();
        Map<String, Integer> types = new LinkedHashMap<>();
        for (FusionResult<T> result : results) {
            if (!result.isMultiSource()) {
                single++;
            }
            double confidence = result.confidence();
            totalConfidence += confidence;
            if (confidence > HIGH_CONFIDENCE) {
                high++;
            } else if (confidence >= MEDIUM_CONFIDENCE) {
                medium++;
            } else {
                low++;
            }
            sources.merge(result.sourceCount(), 1, Integer::sum);
            types.merge(typeOf.apply(result.fusedItem()), 1, Integer::sum);
        }
        int total = results.size();
        return new FusionStatistics(total, single, total - single,
                total == 0 ? 0.0 : totalConfidence / total,
                high, medium, low, sources, types);
    }
}
