package com.datapatch.jackson;

import com.datapatch.value.DataValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

public class DataValueDeserializer extends JsonDeserializer<DataValue> {

    @Override
    public DataValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode tree = p.readValueAsTree();
        return JsonValues.toDataValue(tree);
    }

    /**
     * JSON null is an explicit None, never a missing value.
     */
    @Override
    public DataValue getNullValue(DeserializationContext ctxt) {
        return DataValue.NONE;
    }
}
