package com.knowledge.fusion.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed directed edge between two entities.
 *
 * Confidence is mandatory on construction and defaults to 1.0 when the
 * builder is not given one, so readers never have to check for its presence.
 */
public final class Relation {

    public static final String CONTEXT_PROPERTY = "context";

    private final String id;
    private final String type;
    private final String headEntityId;
    private final String tailEntityId;
    private final Map<String, PropertyValue> properties;
    private final double confidence;

    private Relation(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.headEntityId = Objects.requireNonNull(builder.headEntityId, "headEntityId is required");
        this.tailEntityId = Objects.requireNonNull(builder.tailEntityId, "tailEntityId is required");
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        if (builder.confidence < 0.0 || builder.confidence > 1.0 || Double.isNaN(builder.confidence)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + builder.confidence);
        }
        this.confidence = builder.confidence;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getHeadEntityId() {
        return headEntityId;
    }

    public String getTailEntityId() {
        return tailEntityId;
    }

    public Map<String, PropertyValue> getProperties() {
        return properties;
    }

    public double getConfidence() {
        return confidence;
    }

    public EntityPair pair() {
        return new EntityPair(headEntityId, tailEntityId);
    }

    /**
     * Returns the textual {@code context} property, if present.
     */
    public Optional<String> context() {
        PropertyValue value = properties.get(CONTEXT_PROPERTY);
        if (value instanceof PropertyValue.StringValue text) {
            return Optional.of(text.value());
        }
        return Optional.empty();
    }

    /**
     * Returns true if every field (not only the id) matches.
     */
    public boolean sameContentAs(Relation other) {
        return other != null
                && id.equals(other.id)
                && type.equals(other.type)
                && headEntityId.equals(other.headEntityId)
                && tailEntityId.equals(other.tailEntityId)
                && properties.equals(other.properties)
                && Double.compare(confidence, other.confidence) == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relation that = (Relation) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Relation{" +
                "id='" + id + '\'' +
                ", head='" + headEntityId + '\'' +
                ", type='" + type + '\'' +
                ", tail='" + tailEntityId + '\'' +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Relation relation) {
        return new Builder()
                .id(relation.id)
                .type(relation.type)
                .headEntityId(relation.headEntityId)
                .tailEntityId(relation.tailEntityId)
                .properties(relation.properties)
                .confidence(relation.confidence);
    }

    public static class Builder {
        private String id;
        private String type;
        private String headEntityId;
        private String tailEntityId;
        private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
        private double confidence = 1.0;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder headEntityId(String headEntityId) {
            this.headEntityId = headEntityId;
            return this;
        }

        public Builder tailEntityId(String tailEntityId) {
            this.tailEntityId = tailEntityId;
            return this;
        }

        public Builder property(String key, Object value) {
            this.properties.put(Objects.requireNonNull(key, "key is required"), PropertyValue.from(value));
            return this;
        }

        public Builder properties(Map<String, ? extends PropertyValue> properties) {
            this.properties.clear();
            if (properties != null) {
                this.properties.putAll(properties);
            }
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Relation build() {
            return new Relation(this);
        }
    }
}
