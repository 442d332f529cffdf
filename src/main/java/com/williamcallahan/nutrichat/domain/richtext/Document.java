package com.williamcallahan.nutrichat.domain.richtext;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered blocks produced by one formatting call. Created fresh per call and never mutated.
 *
 * @param blocks blocks in reading order, possibly empty
 */
public record Document(List<Block> blocks) {

    private static final Document EMPTY = new Document(List.of());

    public Document {
        Objects.requireNonNull(blocks, "Document blocks cannot be null");
        blocks = List.copyOf(blocks);
    }

    public static Document empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    /**
     * Returns the visible text of the document with one line per block.
     *
     * @return plain text content
     */
    public String plainText() {
        return blocks.stream().map(Block::plainText).collect(Collectors.joining("\n"));
    }
}
