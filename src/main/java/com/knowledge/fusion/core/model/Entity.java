package com.knowledge.fusion.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;

/**
 * Canonical graph node.
 * Instances are immutable; a store replaces an entity wholesale by id.
 * Property and alias order is insertion order.
 */
public final class Entity {

    public static final String CONFIDENCE_PROPERTY = "confidence";

    private final String id;
    private final String name;
    private final String type;
    private final Map<String, PropertyValue> properties;
    private final Set<String> aliases;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.aliases = Collections.unmodifiableSet(new LinkedHashSet<>(builder.aliases));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public Map<String, PropertyValue> getProperties() {
        return properties;
    }

    public Set<String> getAliases() {
        return aliases;
    }

    /**
     * Returns the numeric {@code confidence} property if the source declared one.
     */
    public OptionalDouble declaredConfidence() {
        PropertyValue value = properties.get(CONFIDENCE_PROPERTY);
        if (value instanceof PropertyValue.NumberValue number) {
            return OptionalDouble.of(number.value());
        }
        return OptionalDouble.empty();
    }

    /**
     * Returns true if every field (not only the id) matches.
     */
    public boolean sameContentAs(Entity other) {
        return other != null
                && id.equals(other.id)
                && name.equals(other.name)
                && type.equals(other.type)
                && properties.equals(other.properties)
                && aliases.equals(other.aliases);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", properties=" + properties.size() +
                ", aliases=" + aliases +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .name(entity.name)
                .type(entity.type)
                .properties(entity.properties)
                .aliases(entity.aliases);
    }

    public static class Builder {
        private String id;
        private String name;
        private String type;
        private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
        private final Set<String> aliases = new LinkedHashSet<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
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

        public Builder alias(String alias) {
            if (alias != null && !alias.isEmpty()) {
                this.aliases.add(alias);
            }
            return this;
        }

        public Builder aliases(Collection<String> aliases) {
            this.aliases.clear();
            if (aliases != null) {
                aliases.forEach(this::alias);
            }
            return this;
        }

        public Entity build() {
            return new Entity(this);
        }
    }
}
