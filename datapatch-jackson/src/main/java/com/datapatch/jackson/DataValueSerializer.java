package com.datapatch.jackson;

import com.datapatch.value.DataValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes values as plain JSON. Ints are written without a decimal point and floats always with
 * one, so the kind survives a round trip.
 */
public class DataValueSerializer extends JsonSerializer<DataValue> {

    @Override
    public void serialize(DataValue value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value instanceof DataValue.NoneValue) {
            gen.writeNull();
        } else if (value instanceof DataValue.DeletionValue) {
            gen.writeStartObject();
            gen.writeBooleanField(JsonValues.DELETION_KEY, true);
            gen.writeEndObject();
        } else if (value instanceof DataValue.BoolValue b) {
            gen.writeBoolean(b.value());
        } else if (value instanceof DataValue.IntValue i) {
            gen.writeNumber(i.value());
        } else if (value instanceof DataValue.FloatValue f) {
            if (Double.isNaN(f.value()) || Double.isInfinite(f.value())) {
                gen.writeNull();
            } else {
                // Double.toString keeps ".0" on whole numbers
                gen.writeNumber(Double.toString(f.value()));
            }
        } else if (value instanceof DataValue.StringValue s) {
            gen.writeString(s.value());
        } else if (value instanceof DataValue.ListValue list) {
            gen.writeStartArray();
            for (DataValue item : list.items()) {
                serialize(item, gen, serializers);
            }
            gen.writeEndArray();
        } else {
            gen.writeStartObject();
            for (var entry : ((DataValue.ObjectValue) value).entries().entrySet()) {
                gen.writeFieldName(entry.getKey());
                serialize(entry.getValue(), gen, serializers);
            }
            gen.writeEndObject();
        }
    }

    @Override
    public Class<DataValue> handledType() {
        return DataValue.class;
    }
}
