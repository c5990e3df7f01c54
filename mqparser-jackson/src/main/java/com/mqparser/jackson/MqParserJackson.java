package com.mqparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for syntax tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = MqParserJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(parseOk.root());
 * </pre>
 */
public final class MqParserJackson {

    private MqParserJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper for syntax tree nodes.
     *
     * The returned mapper:
     * - Writes every node with its kind, id, token range and leaf flag first
     * - Omits absent optional attributes
     * - Writes constants as their source text
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Absent optional attributes are null in the tree and left out of the JSON
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
