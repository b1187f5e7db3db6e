package com.knowledge.fusion.api;

import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.ExtractedRelation;
import com.knowledge.fusion.core.model.Relation;

import java.util.List;

/**
 * Canonical candidates built from extractor output.
 *
 * @param unresolvedRelations extracted relations whose head or tail text matched no entity mention
 */
public record MappedCandidates(
        List<Entity> entities,
        List<Relation> relations,
        List<ExtractedRelation> unresolvedRelations
) {
    public MappedCandidates {
        entities = List.copyOf(entities);
        relations = List.copyOf(relations);
        unresolvedRelations = List.copyOf(unresolvedRelations);
    }
}
