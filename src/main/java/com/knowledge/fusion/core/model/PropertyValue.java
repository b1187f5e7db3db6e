package com.knowledge.fusion.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged property value carried by entities and relations.
 * Every value is exactly one of {@link StringValue}, {@link NumberValue},
 * {@link ListValue} or {@link BoolValue}; each tag has its own merge rule
 * in the fusion layer.
 */
public interface PropertyValue {

    /**
     * Returns the tag of this value.
     */
    Kind kind();

    /**
     * Returns the canonical textual form used for voting and for
     * difference checks (integral numbers render without a fraction).
     */
    String asText();

    /**
     * Returns the plain Java value (String, Double, Boolean or List of plain values).
     */
    Object toPlain();

    enum Kind {
        STRING,
        NUMBER,
        LIST,
        BOOLEAN
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    static NumberValue of(double value) {
        return new NumberValue(value);
    }

    static BoolValue of(boolean value) {
        return new BoolValue(value);
    }

    static ListValue ofList(List<? extends PropertyValue> items) {
        return new ListValue(List.copyOf(items));
    }

    static ListValue ofStrings(String... items) {
        List<PropertyValue> values = new ArrayList<>(items.length);
        for (String item : items) {
            values.add(new StringValue(item));
        }
        return new ListValue(values);
    }

    /**
     * Converts a plain Java value into a tagged value.
     * Maps are rendered as their string form since they have no tag of their own.
     *
     * @throws IllegalArgumentException if the value is null
     */
    static PropertyValue from(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Property values cannot be null");
        }
        if (value instanceof PropertyValue pv) {
            return pv;
        }
        if (value instanceof String s) {
            return new StringValue(s);
        }
        if (value instanceof Boolean b) {
            return new BoolValue(b);
        }
        if (value instanceof Number n) {
            return new NumberValue(n.doubleValue());
        }
        if (value instanceof Collection<?> c) {
            List<PropertyValue> items = new ArrayList<>(c.size());
            for (Object item : c) {
                items.add(from(item));
            }
            return new ListValue(items);
        }
        if (value instanceof Object[] array) {
            return from(List.of(array));
        }
        if (value instanceof Map<?, ?> map) {
            return new StringValue(map.toString());
        }
        return new StringValue(value.toString());
    }

    record StringValue(String value) implements PropertyValue {
        public StringValue {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record NumberValue(double value) implements PropertyValue {
        public NumberValue {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Property numbers must be finite, got " + value);
            }
        }

        public boolean isIntegral() {
            return value == Math.rint(value)
                    && Math.abs(value) < 1e15;
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String asText() {
            return isIntegral() ? Long.toString((long) value) : Double.toString(value);
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record ListValue(List<PropertyValue> items) implements PropertyValue {
        public ListValue {
            items = items != null ? List.copyOf(items) : List.of();
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public String asText() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(items.get(i).asText());
            }
            return sb.append(']').toString();
        }

        @Override
        public Object toPlain() {
            List<Object> plain = new ArrayList<>(items.size());
            for (PropertyValue item : items) {
                plain.add(item.toPlain());
            }
            return plain;
        }
    }

    record BoolValue(boolean value) implements PropertyValue {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }
}
