package com.knowledge.fusion.ontology;

import java.util.List;
import java.util.Objects;

/**
 * Schema entry for a relation type.
 *
 * @param domain entity type the head must have
 * @param range  entity type the tail must have
 */
public record RelationTypeDefinition(String name, String description, String domain, String range,
                                     List<String> properties) {

    public RelationTypeDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(domain, "domain is required");
        Objects.requireNonNull(range, "range is required");
        properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public RelationTypeDefinition(String name, String description, String domain, String range) {
        this(name, description, domain, range, List.of());
    }

    public boolean accepts(String headType, String tailType) {
        return domain.equals(headType) && range.equals(tailType);
    }
}
