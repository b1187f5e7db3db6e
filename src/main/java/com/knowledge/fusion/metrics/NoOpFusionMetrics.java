package com.knowledge.fusion.metrics;

import com.knowledge.fusion.conflict.ConflictType;

import java.time.Duration;

/**
 * No-op implementation of {@link FusionMetrics}.
 */
public class NoOpFusionMetrics implements FusionMetrics {

    public static final NoOpFusionMetrics INSTANCE = new NoOpFusionMetrics();

    @Override
    public void recordFusionPass(String itemKind, int inputCount, int clusterCount, Duration duration) {
    }

    @Override
    public void recordFusionConfidence(String itemKind, double confidence) {
    }

    @Override
    public void incrementConflictDetected(ConflictType type) {
    }

    @Override
    public void incrementConflictFallback(ConflictType type) {
    }

    @Override
    public void incrementRelationRejected() {
    }

    @Override
    public void recordGraphMerge(int entityCount, int relationCount, Duration duration) {
    }
}
