package com.knowledge.fusion.fusion;

import com.knowledge.fusion.core.model.Relation;

import java.util.List;

/**
 * Transient group of candidate relations judged to be the same edge.
 */
public record RelationCluster(
        String clusterId,
        List<Relation> members,
        Relation representative,
        double confidence,
        String method
) {
    public static final String SINGLE_RELATION = "single_relation";
    public static final String SIMILARITY_BASED = "similarity_based";

    public RelationCluster {
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one member");
        }
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }
}
