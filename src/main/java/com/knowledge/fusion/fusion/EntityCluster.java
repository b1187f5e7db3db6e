package com.knowledge.fusion.fusion;

import com.knowledge.fusion.core.model.Entity;

import java.util.List;

/**
 * Transient group of candidate entities judged to be the same thing.
 */
public record EntityCluster(
        String clusterId,
        List<Entity> members,
        Entity representative,
        double confidence,
        String method
) {
    public static final String SINGLE_ENTITY = "single_entity";
    public static final String SIMILARITY_BASED = "similarity_based";

    public EntityCluster {
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one member");
        }
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }
}
