package com.datapatch.jackson;

import com.datapatch.host.Modifiable;
import com.datapatch.host.Selectable;
import com.datapatch.value.DataValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Default wrapper of a {@link JsonDocument} element. Hosts register subclasses in a
 * {@link com.datapatch.host.SelectableRegistry} to give some element types other behavior.
 */
public class JsonSelectable implements Selectable {

    private final String elementType;
    private final JsonElement element;

    public JsonSelectable(String elementType, JsonElement element) {
        this.elementType = elementType;
        this.element = element;
    }

    public JsonElement element() {
        return element;
    }

    @Override
    public String name() {
        return element.node().path(JsonDocument.NAME).asText(null);
    }

    @Override
    public String elementType() {
        return elementType;
    }

    @Override
    public List<String> classes() {
        List<String> classes = new ArrayList<>();
        for (JsonNode clazz : element.node().path(JsonDocument.CLASSES)) {
            if (clazz.isTextual()) {
                classes.add(clazz.textValue());
            }
        }
        return classes;
    }

    @Override
    public List<Selectable> children() {
        JsonNode children = element.node().get(JsonDocument.CHILDREN);
        if (children instanceof ArrayNode array) {
            return element.document().wrapAll(array);
        }
        return List.of();
    }

    @Override
    public boolean isSameAs(Selectable other) {
        return other instanceof JsonSelectable json && json.element.node() == element.node();
    }

    @Override
    public Object identity() {
        return element.node();
    }

    @Override
    public Modifiable openModification() {
        return new JsonModifiable(element);
    }

    @Override
    public Selectable addElement(String elementType) {
        ObjectNode node = element.node();
        JsonNode children = node.get(JsonDocument.CHILDREN);
        ArrayNode array = children instanceof ArrayNode existing ? existing : node.putArray(JsonDocument.CHILDREN);
        return element.document().append(array, elementType, null);
    }

    @Override
    public String serialize() {
        return element.node().toString();
    }

    @Override
    public DataValue getValue() {
        return JsonValues.toDataValue(element.node().get(JsonDocument.VALUE));
    }

    @Override
    public String toString() {
        return elementType + (name() != null ? "#" + name() : "");
    }
}
