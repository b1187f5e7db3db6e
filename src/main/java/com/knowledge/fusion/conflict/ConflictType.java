package com.knowledge.fusion.conflict;

/**
 * Taxonomy of residual contradictions between already-identified items.
 */
public enum ConflictType {
    ENTITY_NAME_CONFLICT("entity_name_conflict"),
    ENTITY_TYPE_CONFLICT("entity_type_conflict"),
    PROPERTY_VALUE_CONFLICT("property_value_conflict"),
    RELATION_TYPE_CONFLICT("relation_type_conflict"),
    /**
     * Reserved: no detector emits this kind yet.
     */
    TEMPORAL_CONFLICT("temporal_conflict"),
    CONTRADICTORY_RELATIONS("contradictory_relations");

    private final String label;

    ConflictType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
