package com.challenges.treenav.json;

import java.util.Objects;

/**
 * One position in a JSON document: the value together with the name it is reachable
 * under from its parent. Array elements are named {@code [i]}, the document root {@code $}.
 */
public record JsonEntry(String name, JsonNode value) {
    public static final String ROOT_NAME = "$";

    public JsonEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public static JsonEntry root(JsonNode document) {
        return new JsonEntry(ROOT_NAME, document);
    }

    public static String indexName(int index) {
        return "[" + index + "]";
    }

    public JsonKind kind() {
        return value.kind();
    }
}
