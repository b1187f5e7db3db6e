package com.knowledge.fusion.ontology;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryOntologyTest {

    private final InMemoryOntology ontology = InMemoryOntology.defaults();

    @Test
    @DisplayName("Default schema knows the common entity and relation types")
    void defaultSchema() {
        assertEquals(6, ontology.getEntityTypes().size());
        assertEquals(10, ontology.getRelationTypes().size());
        assertTrue(ontology.getEntityType("Person").isPresent());
        assertEquals("Organization", ontology.getRelationType("works_for").orElseThrow().range());
        assertTrue(ontology.getRelationType("unknown").isEmpty());
    }

    @Test
    @DisplayName("Relations are checked against domain and range")
    void validateRelation() {
        assertTrue(ontology.validateRelation("works_for", "Person", "Organization"));
        assertFalse(ontology.validateRelation("works_for", "Organization", "Person"));
        assertFalse(ontology.validateRelation("invented", "Person", "Product"));
    }

    @Test
    @DisplayName("Possible relations between two types keep declaration order")
    void possibleRelations() {
        assertEquals(List.of("works_for", "founder_of"), ontology.getPossibleRelations("Person", "Organization"));
        assertEquals(List.of("parent_of", "spouse_of", "friend_of"), ontology.getPossibleRelations("Person", "Person"));
        assertTrue(ontology.getPossibleRelations("Location", "Person").isEmpty());
    }

    @Test
    @DisplayName("Custom schemas are built explicitly")
    void customSchema() {
        InMemoryOntology custom = InMemoryOntology.builder()
                .entityType(new EntityTypeDefinition("Company", "A company", List.of("name"), "Organization"))
                .relationType(new RelationTypeDefinition("acquired", "bought", "Company", "Company"))
                .build();

        assertEquals("Organization", custom.getEntityType("Company").orElseThrow().parentType());
        assertTrue(custom.validateRelation("acquired", "Company", "Company"));
        assertFalse(custom.validateRelation("works_for", "Person", "Organization"));
    }
}
