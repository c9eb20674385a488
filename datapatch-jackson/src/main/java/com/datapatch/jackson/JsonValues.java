package com.datapatch.jackson;

import com.datapatch.value.DataValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link DataValue} and Jackson trees.
 *
 * <p>None maps to JSON null and a deletion marker to {@code {"$deletion":true}}. Integral JSON
 * numbers that fit a long become ints, every other number becomes a float.</p>
 */
public final class JsonValues {

    public static final String DELETION_KEY = "$deletion";

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private JsonValues() {
    }

    public static DataValue toDataValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return DataValue.NONE;
        }
        if (node.isBoolean()) {
            return DataValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return DataValue.of(node.longValue());
        }
        if (node.isNumber()) {
            return DataValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return DataValue.of(node.textValue());
        }
        if (node.isArray()) {
            List<DataValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(toDataValue(item));
            }
            return DataValue.list(items);
        }
        if (node.isObject()) {
            if (isDeletionMarker(node)) {
                return DataValue.DELETION;
            }
            Map<String, DataValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), toDataValue(field.getValue()));
            }
            return DataValue.object(entries);
        }
        throw new IllegalArgumentException("Cannot convert JSON " + node.getNodeType() + " to a value");
    }

    public static JsonNode toJsonNode(DataValue value) {
        if (value instanceof DataValue.NoneValue) {
            return nodes.nullNode();
        }
        if (value instanceof DataValue.DeletionValue) {
            return nodes.objectNode().put(DELETION_KEY, true);
        }
        if (value instanceof DataValue.BoolValue bool) {
            return nodes.booleanNode(bool.value());
        }
        if (value instanceof DataValue.IntValue integer) {
            return nodes.numberNode(integer.value());
        }
        if (value instanceof DataValue.FloatValue number) {
            // JSON has no NaN or infinities
            if (Double.isNaN(number.value()) || Double.isInfinite(number.value())) {
                return nodes.nullNode();
            }
            return nodes.numberNode(number.value());
        }
        if (value instanceof DataValue.StringValue string) {
            return nodes.textNode(string.value());
        }
        if (value instanceof DataValue.ListValue list) {
            ArrayNode array = nodes.arrayNode(list.size());
            for (DataValue item : list.items()) {
                array.add(toJsonNode(item));
            }
            return array;
        }
        DataValue.ObjectValue object = (DataValue.ObjectValue) value;
        ObjectNode result = nodes.objectNode();
        object.entries().forEach((key, entry) -> result.set(key, toJsonNode(entry)));
        return result;
    }

    private static boolean isDeletionMarker(JsonNode node) {
        return node.size() == 1 && node.path(DELETION_KEY).asBoolean(false);
    }
}
