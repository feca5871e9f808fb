package com.challenges.treenav.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Optional;

public sealed interface JsonNode {

    JsonKind kind();

    /**
     * Text of a scalar value as it would appear in a document, strings unquoted.
     * Empty for objects and arrays.
     */
    Optional<String> scalarText();

    // Fields keep document order
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        public static JsonObject empty() {
            return new JsonObject(MapAdapter.adapt(new LinkedHashMap<>()));
        }

        @Override
        public JsonKind kind() {
            return JsonKind.OBJECT;
        }

        @Override
        public Optional<String> scalarText() {
            return Optional.empty();
        }
    }

    record JsonArray(MutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray empty() {
            return new JsonArray(Lists.mutable.empty());
        }

        @Override
        public JsonKind kind() {
            return JsonKind.ARRAY;
        }

        @Override
        public Optional<String> scalarText() {
            return Optional.empty();
        }
    }

    record JsonString(String value) implements JsonNode {
        @Override
        public JsonKind kind() {
            return JsonKind.STRING;
        }

        @Override
        public Optional<String> scalarText() {
            return Optional.of(value);
        }
    }

    record JsonNumber(Number value) implements JsonNode {
        public static JsonNumber of(long value) {
            return new JsonNumber(value);
        }

        public static JsonNumber of(double value) {
            return new JsonNumber(value);
        }

        public static JsonNumber of(BigInteger value) {
            return new JsonNumber(value);
        }

        public static JsonNumber of(BigDecimal value) {
            return new JsonNumber(value);
        }

        public String toJsonString() {
            if (value instanceof Double d && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString(d.longValue());
            }
            return value.toString();
        }

        @Override
        public JsonKind kind() {
            return JsonKind.NUMBER;
        }

        @Override
        public Optional<String> scalarText() {
            return Optional.of(toJsonString());
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {
        @Override
        public JsonKind kind() {
            return JsonKind.BOOLEAN;
        }

        @Override
        public Optional<String> scalarText() {
            return Optional.of(Boolean.toString(value));
        }
    }

    record JsonNull() implements JsonNode {
        @Override
        public JsonKind kind() {
            return JsonKind.NULL;
        }

        @Override
        public Optional<String> scalarText() {
            return Optional.of("null");
        }
    }
}
