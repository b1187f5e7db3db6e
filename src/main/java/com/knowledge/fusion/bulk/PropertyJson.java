package com.knowledge.fusion.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledge.fusion.core.model.PropertyValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between tagged property values and Jackson trees.
 * Integral numbers are written without a fraction.
 */
final class PropertyJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PropertyJson() {
    }

    static ObjectNode toNode(Map<String, PropertyValue> properties) {
        ObjectNode node = NODES.objectNode();
        properties.forEach((key, value) -> node.set(key, toNode(value)));
        return node;
    }

    static JsonNode toNode(PropertyValue value) {
        if (value instanceof PropertyValue.StringValue text) {
            return NODES.textNode(text.value());
        }
        if (value instanceof PropertyValue.NumberValue number) {
            return number.isIntegral()
                    ? NODES.numberNode((long) number.value())
                    : NODES.numberNode(number.value());
        }
        if (value instanceof PropertyValue.BoolValue bool) {
            return NODES.booleanNode(bool.value());
        }
        ArrayNode array = NODES.arrayNode();
        for (PropertyValue item : ((PropertyValue.ListValue) value).items()) {
            array.add(toNode(item));
        }
        return array;
    }

    /**
     * @throws IllegalArgumentException if the node is not an object or holds a null
     */
    static Map<String, PropertyValue> fromNode(JsonNode node) {
        Map<String, PropertyValue> properties = new LinkedHashMap<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return properties;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("properties must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            properties.put(field.getKey(), valueOf(field.getValue(), field.getKey()));
        }
        return properties;
    }

    private static PropertyValue valueOf(JsonNode node, String key) {
        if (node.isTextual()) {
            return PropertyValue.of(node.textValue());
        }
        if (node.isNumber()) {
            return PropertyValue.of(node.doubleValue());
        }
        if (node.isBoolean()) {
            return PropertyValue.of(node.booleanValue());
        }
        if (node.isArray()) {
            List<PropertyValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(valueOf(item, key));
            }
            return PropertyValue.ofList(items);
        }
        if (node.isObject()) {
            return PropertyValue.of(node.toString());
        }
        throw new IllegalArgumentException("property '" + key + "' has no value");
    }
}
