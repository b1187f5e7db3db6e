package com.knowledge.fusion.fusion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of fusing one cluster: the canonical item, the members it was built
 * from, a confidence in [0, 1] and free-form evidence about how it was built.
 *
 * @param <T> {@link com.knowledge.fusion.core.model.Entity} or
 *            {@link com.knowledge.fusion.core.model.Relation}
 */
public record FusionResult<T>(
        T fusedItem,
        List<T> sourceItems,
        double confidence,
        Map<String, Object> evidence
) {
    public static final String METHOD = "method";
    public static final String SOURCE_COUNT = "source_count";
    public static final String CLUSTER_CONFIDENCE = "cluster_confidence";
    public static final String NO_FUSION_NEEDED = "no_fusion_needed";

    public FusionResult {
        Objects.requireNonNull(fusedItem, "fusedItem is required");
        sourceItems = sourceItems != null ? List.copyOf(sourceItems) : List.of();
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        evidence = evidence != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(evidence))
                : Map.of();
    }

    /**
     * Result for a one-member cluster: the item itself at full confidence.
     */
    public static <T> FusionResult<T> single(T item) {
        return new FusionResult<>(item, List.of(item), 1.0, Map.of(METHOD, NO_FUSION_NEEDED));
    }

    public int sourceCount() {
        return sourceItems.size();
    }

    public boolean isMultiSource() {
        return sourceItems.size() > 1;
    }
}
