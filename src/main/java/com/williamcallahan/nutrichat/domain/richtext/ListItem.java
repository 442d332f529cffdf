package com.williamcallahan.nutrichat.domain.richtext;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a list block.
 *
 * @param marker source marker: the bullet character, or the digits of an ordered item
 * @param spans inline content of the item
 */
public record ListItem(String marker, List<Span> spans) {
    public ListItem {
        Objects.requireNonNull(marker, "List marker cannot be null");
        Objects.requireNonNull(spans, "List item spans cannot be null");
        spans = List.copyOf(spans);
    }

    public String plainText() {
        return Span.plainText(spans);
    }
}
