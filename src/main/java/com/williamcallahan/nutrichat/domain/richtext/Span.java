package com.williamcallahan.nutrichat.domain.richtext;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.Objects;

/**
 * Inline styled fragment of a block: plain text, bold, or italic.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(Span.Text.class),
    @JsonSubTypes.Type(Span.Bold.class),
    @JsonSubTypes.Type(Span.Italic.class)
})
public sealed interface Span permits Span.Text, Span.Bold, Span.Italic {

    /**
     * Returns the visible characters of this span, ignoring style.
     *
     * @return plain text content
     */
    String plainText();

    /**
     * Concatenates the visible text of an inline sequence.
     *
     * @param spans inline sequence
     * @return plain text of all spans in order
     */
    static String plainText(List<? extends Span> spans) {
        StringBuilder plainTextBuilder = new StringBuilder();
        for (Span span : spans) {
            plainTextBuilder.append(span.plainText());
        }
        return plainTextBuilder.toString();
    }

    /**
     * Literal text rendered with the base style.
     *
     * @param text non-empty content
     * @param style base style forwarded from the caller
     */
    @JsonTypeName("text")
    record Text(String text, StyleToken style) implements Span {
        public Text {
            Objects.requireNonNull(text, "Text content cannot be null");
            if (text.isEmpty()) {
                throw new IllegalArgumentException("Text content cannot be empty");
            }
            style = style == null ? StyleToken.empty() : style;
        }

        @Override
        public String plainText() {
            return text;
        }
    }

    /**
     * Content delimited by double asterisks. Never contains italics.
     *
     * @param children text fragments inside the delimiters
     */
    @JsonTypeName("bold")
    record Bold(List<Text> children) implements Span {
        public Bold {
            Objects.requireNonNull(children, "Bold children cannot be null");
            if (children.isEmpty()) {
                throw new IllegalArgumentException("Bold span must contain text");
            }
            children = List.copyOf(children);
        }

        @Override
        public String plainText() {
            return Span.plainText(children);
        }
    }

    /**
     * Content delimited by single asterisks.
     *
     * @param text non-empty content
     * @param style base style forwarded from the caller
     */
    @JsonTypeName("italic")
    record Italic(String text, StyleToken style) implements Span {
        public Italic {
            Objects.requireNonNull(text, "Italic content cannot be null");
            if (text.isEmpty()) {
                throw new IllegalArgumentException("Italic content cannot be empty");
            }
            style = style == null ? StyleToken.empty() : style;
        }

        @Override
        public String plainText() {
            return text;
        }
    }
}
