package com.journeynsw.backend.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads an integer flag that the planner sometimes sends as a JSON boolean.
 */
public class IntegerFlagDeserializer extends StdDeserializer<Integer> {

    public IntegerFlagDeserializer() {
        super(Integer.class);
    }

    @Override
    public Integer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_TRUE) {
            return 1;
        }
        if (token == JsonToken.VALUE_FALSE) {
            return 0;
        }
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return p.getIntValue();
        }
        return (Integer) ctxt.handleUnexpectedToken(Integer.class, p);
    }
}
