package com.knowledge.fusion.similarity;

import com.knowledge.fusion.core.model.PropertyValue;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Similarity of two property maps.
 * Formula: 0.5 * keySetJaccard + 0.5 * averageValueSimilarity(common keys).
 *
 * <p>Values under a common key compare as: two strings by the string algorithm,
 * two lists by set Jaccard of their items, anything else by equality.
 * Common keys are visited in sorted order so the score is symmetric.</p>
 */
public class StructuralSimilarity {

    private static final double KEY_WEIGHT = 0.5;
    private static final double VALUE_WEIGHT = 0.5;

    private final SimilarityAlgorithm stringSimilarity;

    public StructuralSimilarity(SimilarityAlgorithm stringSimilarity) {
        this.stringSimilarity = stringSimilarity;
    }

    public double compute(Map<String, PropertyValue> first, Map<String, PropertyValue> second) {
        boolean firstEmpty = first == null || first.isEmpty();
        boolean secondEmpty = second == null || second.isEmpty();
        if (firstEmpty && secondEmpty) {
            return 1.0;
        }
        if (firstEmpty || secondEmpty) {
            return 0.0;
        }

        Set<String> commonKeys = new TreeSet<>(first.keySet());
        commonKeys.retainAll(second.keySet());
        int unionSize = first.size() + second.size() - commonKeys.size();
        double keySimilarity = (double) commonKeys.size() / unionSize;

        double valueSum = 0.0;
        for (String key : commonKeys) {
            valueSum += valueSimilarity(first.get(key), second.get(key));
        }
        double averageValueSimilarity = commonKeys.isEmpty() ? 0.0 : valueSum / commonKeys.size();

        return KEY_WEIGHT * keySimilarity + VALUE_WEIGHT * averageValueSimilarity;
    }

    double valueSimilarity(PropertyValue first, PropertyValue second) {
        if (first instanceof PropertyValue.StringValue a && second instanceof PropertyValue.StringValue b) {
            return stringSimilarity.compute(a.value(), b.value());
        }
        if (first instanceof PropertyValue.ListValue a && second instanceof PropertyValue.ListValue b) {
            return setJaccard(a, b);
        }
        return first.equals(second) ? 1.0 : 0.0;
    }

    static double setJaccard(PropertyValue.ListValue first, PropertyValue.ListValue second) {
        Set<PropertyValue> set1 = new HashSet<>(first.items());
        Set<PropertyValue> set2 = new HashSet<>(second.items());
        if (set1.isEmpty() && set2.isEmpty()) {
            return 1.0;
        }
        if (set1.isEmpty() || set2.isEmpty()) {
            return 0.0;
        }
        int intersectionSize = 0;
        for (PropertyValue item : set1) {
            if (set2.contains(item)) {
                intersectionSize++;
            }
        }
        return (double) intersectionSize / (set1.size() + set2.size() - intersectionSize);
    }
}
