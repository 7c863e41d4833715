package com.texcalc.input;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a batch of expressions from a JSON array. Elements are either strings or objects with
 * an {@code "expression"} field; numbers are accepted and kept as their literal text.
 */
public class ExpressionListReader {
    private final JsonFactory factory = new JsonFactory();

    public MutableList<String> read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_ARRAY) {
                throw new IOException("Expected a JSON array of expressions but found " + token);
            }
            return readArray(parser);
        }
    }

    private MutableList<String> readArray(JsonParser parser) throws IOException {
        MutableList<String> expressions = Lists.mutable.empty();

        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            if (token == null) {
                throw new IOException("Unterminated JSON array");
            }
            switch (token) {
                case VALUE_STRING, VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> expressions.add(parser.getText());
                case START_OBJECT -> expressions.add(readObject(parser));
                default -> throw new IOException("Unexpected JSON token in expression list: " + token);
            }
        }

        return expressions;
    }

    private String readObject(JsonParser parser) throws IOException {
        String expression = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken value = parser.nextToken();
            if ("expression".equals(fieldName) && value == JsonToken.VALUE_STRING) {
                expression = parser.getText();
            } else {
                parser.skipChildren();
            }
        }

        if (expression == null) {
            throw new IOException("Object in expression list has no \"expression\" string field");
        }
        return expression;
    }
}
