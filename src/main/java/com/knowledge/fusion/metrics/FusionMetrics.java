package com.knowledge.fusion.metrics;

import com.knowledge.fusion.conflict.ConflictType;

import java.time.Duration;

/**
 * Interface for recording fusion, conflict and graph-store metrics.
 * The default {@link NoOpFusionMetrics} does nothing, so the library works
 * without a meter registry.
 */
public interface FusionMetrics {

    /**
     * @param itemKind "entity" or "relation"
     */
    void recordFusionPass(String itemKind, int inputCount, int clusterCount, Duration duration);

    void recordFusionConfidence(String itemKind, double confidence);

    void incrementConflictDetected(ConflictType type);

    void incrementConflictFallback(ConflictType type);

    void incrementRelationRejected();

    void recordGraphMerge(int entityCount, int relationCount, Duration duration);
}
