package com.williamcallahan.nutrichat.domain.richtext;

import java.util.Objects;

/**
 * Result of a service-level formatting call.
 *
 * @param document formatted document
 * @param cached true when the document came from the render cache
 * @param truncated true when the input exceeded the configured length limit
 * @param processingTimeMs time spent producing the document
 */
public record FormattedRichText(Document document, boolean cached, boolean truncated, long processingTimeMs) {
    public FormattedRichText {
        Objects.requireNonNull(document, "Formatted document cannot be null");
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("Processing time must be non-negative");
        }
    }
}
