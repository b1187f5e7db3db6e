package com.knowledge.fusion.fusion;

/**
 * Strategies for combining the confidences of duplicate relations.
 */
public enum ConfidenceFusionStrategy {
    MAX,
    AVERAGE,
    /**
     * Average boosted by up to 20%, scaled by {@code min(1, n/5)}, capped at 1.0.
     */
    WEIGHTED_AVERAGE
}
