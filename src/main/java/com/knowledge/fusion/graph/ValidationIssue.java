package com.knowledge.fusion.graph;

/**
 * One problem found by {@link KnowledgeGraphStore#validate()}.
 */
public record ValidationIssue(Kind kind, String relationId, String message) {

    public enum Kind {
        /**
         * A relation endpoint is not a present entity.
         */
        ORPHANED_RELATION,

        /**
         * The relation violates the ontology's domain/range for its type.
         */
        ONTOLOGY_MISMATCH
    }
}
