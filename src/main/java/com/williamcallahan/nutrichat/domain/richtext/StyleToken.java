package com.williamcallahan.nutrichat.domain.richtext;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Opaque base style forwarded to every leaf span so a renderer can apply default typography.
 * The formatter never interprets the attributes.
 *
 * @param attributes renderer-defined style attributes
 */
public record StyleToken(Map<String, String> attributes) {

    private static final StyleToken EMPTY = new StyleToken(Map.of());

    public StyleToken {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Returns the default token used when the caller supplies no base style.
     *
     * @return token without attributes
     */
    public static StyleToken empty() {
        return EMPTY;
    }

    /**
     * Creates a token from a JSON attribute map, treating null as empty.
     *
     * @param attributes style attributes, may be null
     * @return style token
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static StyleToken of(Map<String, String> attributes) {
        return attributes == null || attributes.isEmpty() ? EMPTY : new StyleToken(attributes);
    }

    @JsonValue
    @Override
    public Map<String, String> attributes() {
        return attributes;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return attributes.isEmpty();
    }
}
