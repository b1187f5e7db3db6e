package com.knowledge.fusion.conflict;

import java.util.Collections;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A detected contradiction between already-identified items.
 *
 * <p>Conflicting items are typed per kind: names and type names are {@code String},
 * property conflicts carry {@link com.knowledge.fusion.core.model.PropertyValue}s,
 * relation-type conflicts carry type names and contradictory-relation conflicts
 * carry the {@link com.knowledge.fusion.core.model.Relation}s themselves.
 * Confidence scores are parallel to the items.</p>
 *
 * <p>The resolution fields are written exactly once.</p>
 */
public class Conflict {

    private final String id;
    private final ConflictType type;
    private final String description;
    private final String subjectId;
    private final String propertyKey;
    private final List<Object> conflictingItems;
    private final List<Double> confidenceScores;

    private ResolutionStrategy strategy;
    private Object resolvedValue;
    private double resolutionConfidence;
    private boolean fallback;
    private boolean resolved;

    public Conflict(String id, ConflictType type, String description, String subjectId, String propertyKey,
                    List<?> conflictingItems, List<Double> confidenceScores) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.type = Objects.requireNonNull(type, "type is required");
        this.description = description;
        this.subjectId = subjectId;
        this.propertyKey = propertyKey;
        if (conflictingItems == null || conflictingItems.isEmpty()) {
            throw new IllegalArgumentException("A conflict needs at least one conflicting item");
        }
        this.conflictingItems = Collections.unmodifiableList(new ArrayList<>(conflictingItems));
        this.confidenceScores = confidenceScores != null ? List.copyOf(confidenceScores) : List.of();
    }

    public String getId() {
        return id;
    }

    public ConflictType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Entity id, or {@code head->tail} for relation conflicts.
     */
    public String getSubjectId() {
        return subjectId;
    }

    /**
     * Property key of a {@link ConflictType#PROPERTY_VALUE_CONFLICT}, null otherwise.
     */
    public String getPropertyKey() {
        return propertyKey;
    }

    public List<Object> getConflictingItems() {
        return conflictingItems;
    }

    public List<Double> getConfidenceScores() {
        return confidenceScores;
    }

    public ResolutionStrategy getStrategy() {
        return strategy;
    }

    public Object getResolvedValue() {
        return resolvedValue;
    }

    public double getResolutionConfidence() {
        return resolutionConfidence;
    }

    /**
     * True if the chosen strategy failed and the first item was taken instead.
     */
    public boolean isFallback() {
        return fallback;
    }

    public boolean isResolved() {
        return resolved;
    }

    synchronized void resolve(ResolutionStrategy strategy, Object value, double confidence, boolean fallback) {
        if (resolved) {
            throw new IllegalStateException("Conflict already resolved: " + id);
        }
        this.strategy = strategy;
        this.resolvedValue = value;
        this.resolutionConfidence = confidence;
        this.fallback = fallback;
        this.resolved = true;
    }

    @Override
    public String toString() {
        return "Conflict{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", items=" + conflictingItems.size() +
                ", strategy=" + strategy +
                ", resolved=" + resolved +
                '}';
    }
}
