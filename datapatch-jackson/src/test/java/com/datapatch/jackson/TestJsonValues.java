package com.datapatch.jackson;

import com.datapatch.value.DataKind;
import com.datapatch.value.DataValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestJsonValues {

    private final ObjectMapper mapper = DatapatchJackson.createObjectMapper();

    @Test
    void testNumbersKeepTheirKind() throws Exception {
        JsonNode tree = mapper.readTree("""
            {"count": 3, "ratio": 3.0, "big": 12345678901234567890}
            """);

        DataValue.ObjectValue value = (DataValue.ObjectValue) JsonValues.toDataValue(tree);

        assertEquals(DataValue.of(3L), value.get("count"));
        assertEquals(DataValue.of(3.0), value.get("ratio"));
        assertEquals(DataKind.FLOAT, value.get("big").kind());
    }

    @Test
    void testNullAndDeletion() throws Exception {
        DataValue value = JsonValues.toDataValue(mapper.readTree("""
            [null, {"$deletion": true}, {"$deletion": true, "other": 1}]
            """));

        DataValue.ListValue list = (DataValue.ListValue) value;
        assertTrue(list.get(0).isNone());
        assertTrue(list.get(1).isDeletion());
        assertEquals(DataKind.OBJECT, list.get(2).kind());
        assertEquals("{\"$deletion\":true}", JsonValues.toJsonNode(DataValue.DELETION).toString());
        assertTrue(JsonValues.toJsonNode(DataValue.NONE).isNull());
    }

    @Test
    void testObjectOrderIsKept() {
        DataValue value = DataValue.object(
            "zeta", DataValue.of(1L),
            "alpha", DataValue.list(DataValue.of(true), DataValue.of("x")),
            "mid", DataValue.of(0.5));

        JsonNode json = JsonValues.toJsonNode(value);

        assertEquals("{\"zeta\":1,\"alpha\":[true,\"x\"],\"mid\":0.5}", json.toString());
        assertEquals(value, JsonValues.toDataValue(json));
    }

    @Test
    void testNonFiniteFloatsBecomeNull() {
        assertTrue(JsonValues.toJsonNode(DataValue.of(Double.NaN)).isNull());
        assertTrue(JsonValues.toJsonNode(DataValue.of(Double.POSITIVE_INFINITY)).isNull());
    }
}
