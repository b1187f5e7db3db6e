package com.knowledge.fusion.fusion;

import com.knowledge.fusion.core.model.PropertyValue;
import com.knowledge.fusion.core.model.PropertyValue.Kind;
import com.knowledge.fusion.core.model.PropertyValue.ListValue;
import com.knowledge.fusion.core.model.PropertyValue.NumberValue;
import com.knowledge.fusion.core.model.PropertyValue.StringValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-key merge functions for tagged property values.
 * Keys of the result keep first-seen order across the source maps; every
 * tie is broken in favour of the earliest source.
 */
public final class PropertyMerger {

    private PropertyMerger() {
    }

    /**
     * Entity merge: strings keep the longest value, numbers the arithmetic mean,
     * lists the de-duplicated union, anything else (mixed tags, booleans) the
     * most frequent value.
     */
    public static Map<String, PropertyValue> mergeEntityProperties(List<Map<String, PropertyValue>> sources) {
        Map<String, PropertyValue> merged = new LinkedHashMap<>();
        collectByKey(sources).forEach((key, values) -> merged.put(key, mergeEntityValues(values)));
        return merged;
    }

    /**
     * Relation merge under the given strategy. With {@link PropertyFusionStrategy#INTERSECTION}
     * a key whose scalar values disagree is omitted.
     */
    public static Map<String, PropertyValue> mergeRelationProperties(List<Map<String, PropertyValue>> sources,
                                                                     PropertyFusionStrategy strategy) {
        Map<String, PropertyValue> merged = new LinkedHashMap<>();
        collectByKey(sources).forEach((key, values) -> {
            Optional<PropertyValue> value = switch (strategy) {
                case UNION -> Optional.of(union(values));
                case INTERSECTION -> intersection(values);
                case VOTE -> Optional.of(mostFrequent(values));
            };
            value.ifPresent(v -> merged.put(key, v));
        });
        return merged;
    }

    static PropertyValue mergeEntityValues(List<PropertyValue> values) {
        if (values.size() == 1) {
            return values.get(0);
        }
        if (allOfKind(values, Kind.STRING)) {
            return longestString(values);
        }
        if (allOfKind(values, Kind.NUMBER)) {
            return mean(values);
        }
        if (allOfKind(values, Kind.LIST)) {
            return listUnion(values);
        }
        return mostFrequent(values);
    }

    static PropertyValue union(List<PropertyValue> values) {
        if (values.size() == 1) {
            return values.get(0);
        }
        if (allOfKind(values, Kind.LIST)) {
            return listUnion(values);
        }
        if (allOfKind(values, Kind.STRING)) {
            return longestString(values);
        }
        return mostFrequent(values);
    }

    static Optional<PropertyValue> intersection(List<PropertyValue> values) {
        if (values.size() == 1) {
            return Optional.of(values.get(0));
        }
        if (allOfKind(values, Kind.LIST)) {
            List<PropertyValue> common = new ArrayList<>(new LinkedHashSet<>(((ListValue) values.get(0)).items()));
            for (int i = 1; i < values.size(); i++) {
                common.retainAll(((ListValue) values.get(i)).items());
            }
            return Optional.of(new ListValue(common));
        }
        String first = values.get(0).asText();
        for (PropertyValue value : values) {
            if (!value.asText().equals(first)) {
                return Optional.empty();
            }
        }
        return Optional.of(values.get(0));
    }

    /**
     * Most frequent value by textual form, mapped back to the first original
     * carrying that form. Ties go to the form seen first.
     */
    public static PropertyValue mostFrequent(List<PropertyValue> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot vote over an empty value list");
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, PropertyValue> firstByText = new LinkedHashMap<>();
        for (PropertyValue value : values) {
            String text = value.asText();
            counts.merge(text, 1, Integer::sum);
            firstByText.putIfAbsent(text, value);
        }
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                winner = entry.getKey();
            }
        }
        return firstByText.get(winner);
    }

    static PropertyValue longestString(List<PropertyValue> values) {
        PropertyValue longest = values.get(0);
        for (PropertyValue value : values) {
            if (((StringValue) value).value().length() > ((StringValue) longest).value().length()) {
                longest = value;
            }
        }
        return longest;
    }

    static PropertyValue mean(List<PropertyValue> values) {
        double sum = 0.0;
        for (PropertyValue value : values) {
            sum += ((NumberValue) value).value();
        }
        return new NumberValue(sum / values.size());
    }

    static PropertyValue listUnion(List<PropertyValue> values) {
        Set<PropertyValue> items = new LinkedHashSet<>();
        for (PropertyValue value : values) {
            items.addAll(((ListValue) value).items());
        }
        return new ListValue(new ArrayList<>(items));
    }

    public static boolean allOfKind(List<PropertyValue> values, Kind kind) {
        for (PropertyValue value : values) {
            if (value.kind() != kind) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, List<PropertyValue>> collectByKey(List<Map<String, PropertyValue>> sources) {
        Map<String, List<PropertyValue>> byKey = new LinkedHashMap<>();
        for (Map<String, PropertyValue> source : sources) {
            source.forEach((key, value) -> byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(value));
        }
        return byKey;
    }
}
