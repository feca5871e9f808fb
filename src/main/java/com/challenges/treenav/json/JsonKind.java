package com.challenges.treenav.json;

import java.util.Locale;

public enum JsonKind {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JsonKind fromLabel(String label) {
        for (JsonKind kind : values()) {
            if (kind.label().equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown JSON type: " + label);
    }
}
