package com.challenges.treenav.json;

import com.challenges.treenav.search.SearchCriteria;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Ready-made {@link SearchCriteria} over {@link JsonEntry} positions.
 */
public final class JsonCriteria {

    private JsonCriteria() {
    }

    public static SearchCriteria<JsonEntry> ofType(JsonKind kind) {
        Objects.requireNonNull(kind, "kind");
        return SearchCriteria.matching(entry -> entry.kind() == kind);
    }

    /**
     * Strings, numbers, booleans and nulls.
     */
    public static SearchCriteria<JsonEntry> scalar() {
        return SearchCriteria.matching(entry -> entry.value().scalarText().isPresent());
    }

    public static SearchCriteria<JsonEntry> nameEquals(String name) {
        Objects.requireNonNull(name, "name");
        return SearchCriteria.matching(entry -> entry.name().equals(name));
    }

    public static SearchCriteria<JsonEntry> nameStartsWith(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return SearchCriteria.matching(entry -> entry.name().startsWith(prefix));
    }

    public static SearchCriteria<JsonEntry> nameEndsWith(String suffix) {
        Objects.requireNonNull(suffix, "suffix");
        return SearchCriteria.matching(entry -> entry.name().endsWith(suffix));
    }

    // Unanchored: the pattern may match anywhere in the name
    public static SearchCriteria<JsonEntry> nameMatches(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return SearchCriteria.matching(entry -> pattern.matcher(entry.name()).find());
    }

    public static SearchCriteria<JsonEntry> valueEquals(String text) {
        Objects.requireNonNull(text, "text");
        return SearchCriteria.matching(entry -> entry.value().scalarText().map(text::equals).orElse(false));
    }

    public static SearchCriteria<JsonEntry> valueMatches(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return SearchCriteria.matching(entry -> entry.value().scalarText()
                .map(value -> pattern.matcher(value).find())
                .orElse(false));
    }
}
