package com.knowledge.fusion.graph;

/**
 * Runtime exception thrown when a relation references an entity that is not
 * in the store. The store is left unchanged.
 */
public class GraphValidationException extends RuntimeException {

    private final String relationId;
    private final String missingEntityId;

    public GraphValidationException(String relationId, String missingEntityId) {
        super("Relation " + relationId + " references missing entity " + missingEntityId);
        this.relationId = relationId;
        this.missingEntityId = missingEntityId;
    }

    public String getRelationId() {
        return relationId;
    }

    public String getMissingEntityId() {
        return missingEntityId;
    }
}
