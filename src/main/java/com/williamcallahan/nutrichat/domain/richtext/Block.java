package com.williamcallahan.nutrichat.domain.richtext;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Top-level structural unit of a formatted document.
 * The set of variants is closed; renderers dispatch on the concrete record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(Block.Heading.class),
    @JsonSubTypes.Type(Block.SectionHeader.class),
    @JsonSubTypes.Type(Block.Paragraph.class),
    @JsonSubTypes.Type(Block.ListBlock.class),
    @JsonSubTypes.Type(Block.Spacer.class)
})
public sealed interface Block
    permits Block.Heading, Block.SectionHeader, Block.Paragraph, Block.ListBlock, Block.Spacer {

    /**
     * Returns the visible text of this block, ignoring style. List items are joined by newlines.
     *
     * @return plain text content
     */
    String plainText();

    /**
     * Heading introduced by one to three {@code #} characters.
     *
     * @param level heading depth, 1 to 3
     * @param text inline content with the prefix removed
     */
    @JsonTypeName("heading")
    record Heading(int level, List<Span> text) implements Block {
        public Heading {
            if (level < 1 || level > 3) {
                throw new IllegalArgumentException("Heading level must be between 1 and 3: " + level);
            }
            Objects.requireNonNull(text, "Heading text cannot be null");
            text = List.copyOf(text);
        }

        @Override
        public String plainText() {
            return Span.plainText(text);
        }
    }

    /**
     * Line ending in a colon that titles the content below it.
     *
     * @param text inline content, colon included
     */
    @JsonTypeName("sectionHeader")
    record SectionHeader(List<Span> text) implements Block {
        public SectionHeader {
            Objects.requireNonNull(text, "Section header text cannot be null");
            text = List.copyOf(text);
        }

        @Override
        public String plainText() {
            return Span.plainText(text);
        }
    }

    /**
     * Any other non-empty line.
     *
     * @param spans inline content
     * @param indented true once any section header appeared earlier in the document
     */
    @JsonTypeName("paragraph")
    record Paragraph(List<Span> spans, boolean indented) implements Block {
        public Paragraph {
            Objects.requireNonNull(spans, "Paragraph spans cannot be null");
            spans = List.copyOf(spans);
        }

        @Override
        public String plainText() {
            return Span.plainText(spans);
        }
    }

    /**
     * Maximal run of consecutive list lines of the same kind.
     *
     * @param kind marker family shared by every item
     * @param items entries in source order
     */
    @JsonTypeName("list")
    record ListBlock(ListKind kind, List<ListItem> items) implements Block {
        public ListBlock {
            Objects.requireNonNull(kind, "List kind cannot be null");
            Objects.requireNonNull(items, "List items cannot be null");
            if (items.isEmpty()) {
                throw new IllegalArgumentException("List block must contain at least one item");
            }
            items = List.copyOf(items);
        }

        @Override
        public String plainText() {
            return items.stream().map(ListItem::plainText).collect(Collectors.joining("\n"));
        }
    }

    /**
     * Vertical gap produced by a blank line.
     */
    @JsonTypeName("spacer")
    record Spacer() implements Block {
        @Override
        public String plainText() {
            return "";
        }
    }
}
