package com.williamcallahan.nutrichat.domain.richtext;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Accepts model-generated text and an optional base style for formatting.
 *
 * @param text text to format
 * @param baseStyle style forwarded to every leaf span
 */
public record RichTextFormatRequest(String text, StyleToken baseStyle) {

    /**
     * Creates a request while normalizing absent fields.
     *
     * @param text text to format, may be null
     * @param baseStyle style attributes, may be null
     * @return normalized format request
     */
    @JsonCreator
    public static RichTextFormatRequest create(@JsonProperty("text") String text,
                                               @JsonProperty("baseStyle") Map<String, String> baseStyle) {
        return new RichTextFormatRequest(text == null ? "" : text, StyleToken.of(baseStyle));
    }

    public RichTextFormatRequest {
        Objects.requireNonNull(text, "Text cannot be null");
        baseStyle = baseStyle == null ? StyleToken.empty() : baseStyle;
    }
}
