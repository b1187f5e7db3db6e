package com.knowledge.fusion.graph;

import java.util.List;

/**
 * Result of adding a batch of relations: accepted ones are in the store,
 * rejected ones left it untouched.
 */
public record IngestResult(int accepted, List<RejectedRelation> rejected) {

    public IngestResult {
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public int rejectedCount() {
        return rejected.size();
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    /**
     * @param relationId the refused relation
     * @param reason     why the store refused it
     */
    public record RejectedRelation(String relationId, String reason) {}
}
