package com.knowledge.fusion.ontology;

import java.util.List;
import java.util.Objects;

/**
 * Schema entry for an entity type.
 *
 * @param parentType name of the parent type, or null for a root type
 */
public record EntityTypeDefinition(String name, String description, List<String> properties, String parentType) {

    public EntityTypeDefinition {
        Objects.requireNonNull(name, "name is required");
        properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public EntityTypeDefinition(String name, String description, List<String> properties) {
        this(name, description, properties, null);
    }
}
