package com.knowledge.fusion.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of {@link KnowledgeGraphStore#mergeKnowledgeGraph}.
 *
 * @param entityIdRemap     every input entity id mapped to the id of the entity it was fused into
 * @param droppedRelations  relations whose remapped endpoint did not survive
 */
public record MergeReport(
        int inputEntities,
        int outputEntities,
        int inputRelations,
        int outputRelations,
        int droppedRelations,
        Map<String, String> entityIdRemap
) {
    public MergeReport {
        entityIdRemap = Collections.unmodifiableMap(new LinkedHashMap<>(entityIdRemap));
    }

    public int fusedEntities() {
        return inputEntities - outputEntities;
    }
}
