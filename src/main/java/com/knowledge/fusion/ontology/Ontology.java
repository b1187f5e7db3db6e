package com.knowledge.fusion.ontology;

import java.util.List;
import java.util.Optional;

/**
 * Entity-type and relation-type schema consulted by the graph store.
 */
public interface Ontology {

    Optional<EntityTypeDefinition> getEntityType(String name);

    Optional<RelationTypeDefinition> getRelationType(String name);

    /**
     * @return true if the relation type is declared and its domain/range match exactly
     */
    boolean validateRelation(String relationType, String headType, String tailType);

    /**
     * Relation types whose domain/range accept the given pair, in declaration order.
     */
    List<String> getPossibleRelations(String headType, String tailType);
}
