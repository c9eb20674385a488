package com.datapatch.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for patch ASTs, parse trees
 * and JSON documents.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = DatapatchJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(patch);
 * Patch patch = mapper.readValue(json, Patch.class);
 * </pre>
 */
public final class DatapatchJackson {

    private DatapatchJackson() {
        // Utility class
    }

    /**
     * The returned mapper omits null fields (absent indexers, defaults and names), ignores
     * unknown properties on input and writes nodes with a "type" discriminator.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
