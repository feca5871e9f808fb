package com.challenges.treenav.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;

public class JsonDocumentParser {
    private final JsonFactory factory = new JsonFactory();

    public JsonNode parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken first = parser.nextToken();
            if (first == null) {
                throw new IOException("No JSON content");
            }
            JsonNode document = parseValue(parser, first);
            JsonToken trailing = parser.nextToken();
            if (trailing != null) {
                throw new IOException("Unexpected trailing content: " + trailing);
            }
            return document;
        }
    }

    public JsonNode parse(String json) throws IOException {
        return parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    private JsonNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> parseInteger(parser);
            case VALUE_NUMBER_FLOAT -> parseFloat(parser);
            case VALUE_TRUE -> new JsonNode.JsonBoolean(true);
            case VALUE_FALSE -> new JsonNode.JsonBoolean(false);
            case VALUE_NULL -> new JsonNode.JsonNull();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonNode.JsonNumber parseInteger(JsonParser parser) throws IOException {
        if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
            return JsonNode.JsonNumber.of(parser.getBigIntegerValue());
        }
        return JsonNode.JsonNumber.of(parser.getLongValue());
    }

    // Values beyond double range keep their exact decimal form
    private JsonNode.JsonNumber parseFloat(JsonParser parser) throws IOException {
        double value = parser.getDoubleValue();
        if (Double.isInfinite(value)) {
            return JsonNode.JsonNumber.of(parser.getDecimalValue());
        }
        return JsonNode.JsonNumber.of(value);
    }

    private JsonNode.JsonObject parseObject(JsonParser parser) throws IOException {
        MutableMap<String, JsonNode> fields = MapAdapter.adapt(new LinkedHashMap<>());

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return new JsonNode.JsonObject(fields);
    }

    private JsonNode.JsonArray parseArray(JsonParser parser) throws IOException {
        MutableList<JsonNode> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new JsonNode.JsonArray(elements);
    }
}
