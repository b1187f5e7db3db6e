package com.knowledge.fusion.core.model;

import java.util.Objects;

/**
 * Ordered (head, tail) key used by the relation indices.
 */
public record EntityPair(String headEntityId, String tailEntityId) {

    public EntityPair {
        Objects.requireNonNull(headEntityId, "headEntityId is required");
        Objects.requireNonNull(tailEntityId, "tailEntityId is required");
    }

    public EntityPair reversed() {
        return new EntityPair(tailEntityId, headEntityId);
    }
}
