package com.knowledge.fusion.fusion;

/**
 * Strategies for combining the properties of duplicate relations.
 */
public enum PropertyFusionStrategy {
    /**
     * Lists are concatenated and de-duplicated, strings keep the longest value,
     * anything else takes the most frequent value.
     */
    UNION,

    /**
     * Lists are intersected; any other key survives only when every source agrees.
     */
    INTERSECTION,

    /**
     * Most frequent value by textual form.
     */
    VOTE
}
