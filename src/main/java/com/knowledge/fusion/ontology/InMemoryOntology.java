package com.knowledge.fusion.ontology;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@link Ontology} held in memory.
 */
public class InMemoryOntology implements Ontology {

    private final Map<String, EntityTypeDefinition> entityTypes;
    private final Map<String, RelationTypeDefinition> relationTypes;

    private InMemoryOntology(Builder builder) {
        this.entityTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.entityTypes));
        this.relationTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.relationTypes));
    }

    /**
     * People, organizations, places, events, products and concepts, with the
     * relations commonly extracted between them.
     */
    public static InMemoryOntology defaults() {
        return builder()
                .entityType(new EntityTypeDefinition("Person", "A person",
                        List.of("name", "age", "occupation", "nationality")))
                .entityType(new EntityTypeDefinition("Organization", "A company or institution",
                        List.of("name", "type", "founded_year", "location")))
                .entityType(new EntityTypeDefinition("Location", "A geographic place",
                        List.of("name", "type", "coordinates", "population")))
                .entityType(new EntityTypeDefinition("Event", "Something that happened",
                        List.of("name", "date", "location", "participants")))
                .entityType(new EntityTypeDefinition("Product", "A product or service",
                        List.of("name", "category", "price", "manufacturer")))
                .entityType(new EntityTypeDefinition("Concept", "An abstract concept",
                        List.of("name", "definition", "category")))
                .relationType(new RelationTypeDefinition("works_for", "works for", "Person", "Organization"))
                .relationType(new RelationTypeDefinition("located_in", "is located in", "Organization", "Location"))
                .relationType(new RelationTypeDefinition("born_in", "was born in", "Person", "Location"))
                .relationType(new RelationTypeDefinition("participated_in", "took part in", "Person", "Event"))
                .relationType(new RelationTypeDefinition("occurred_at", "happened at", "Event", "Location"))
                .relationType(new RelationTypeDefinition("produces", "makes", "Organization", "Product"))
                .relationType(new RelationTypeDefinition("founder_of", "founded", "Person", "Organization"))
                .relationType(new RelationTypeDefinition("parent_of", "is a parent of", "Person", "Person"))
                .relationType(new RelationTypeDefinition("spouse_of", "is married to", "Person", "Person"))
                .relationType(new RelationTypeDefinition("friend_of", "is a friend of", "Person", "Person"))
                .build();
    }

    @Override
    public Optional<EntityTypeDefinition> getEntityType(String name) {
        return Optional.ofNullable(entityTypes.get(name));
    }

    @Override
    public Optional<RelationTypeDefinition> getRelationType(String name) {
        return Optional.ofNullable(relationTypes.get(name));
    }

    @Override
    public boolean validateRelation(String relationType, String headType, String tailType) {
        RelationTypeDefinition definition = relationTypes.get(relationType);
        return definition != null && definition.accepts(headType, tailType);
    }

    @Override
    public List<String> getPossibleRelations(String headType, String tailType) {
        List<String> possible = new ArrayList<>();
        for (RelationTypeDefinition definition : relationTypes.values()) {
            if (definition.accepts(headType, tailType)) {
                possible.add(definition.name());
            }
        }
        return possible;
    }

    public Collection<EntityTypeDefinition> getEntityTypes() {
        return entityTypes.values();
    }

    public Collection<RelationTypeDefinition> getRelationTypes() {
        return relationTypes.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, EntityTypeDefinition> entityTypes = new LinkedHashMap<>();
        private final Map<String, RelationTypeDefinition> relationTypes = new LinkedHashMap<>();

        public Builder entityType(EntityTypeDefinition definition) {
            entityTypes.put(definition.name(), definition);
            return this;
        }

        public Builder relationType(RelationTypeDefinition definition) {
            relationTypes.put(definition.name(), definition);
            return this;
        }

        public InMemoryOntology build() {
            return new InMemoryOntology(this);
        }
    }
}
