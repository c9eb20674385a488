package com.datapatch.jackson;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One element object of a {@link JsonDocument} together with the array that holds it.
 */
public record JsonElement(
    JsonDocument document,
    ObjectNode node,
    ArrayNode container
) {

    public String elementType() {
        return node.path(JsonDocument.TYPE).asText(null);
    }
}
