package com.williamcallahan.nutrichat.domain.richtext;

import java.util.Objects;

/**
 * Describes a successfully formatted document returned to the presentation layer.
 */
public record RichTextFormatOutcome(Document document, boolean cached, boolean truncated, long processingTimeMs)
        implements RichTextFormatResponse {
    public RichTextFormatOutcome {
        Objects.requireNonNull(document, "Document cannot be null");
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("Processing time must be non-negative");
        }
    }

    /**
     * Maps a service result onto the API payload.
     *
     * @param formatted service result
     * @return response payload
     */
    public static RichTextFormatOutcome from(FormattedRichText formatted) {
        return new RichTextFormatOutcome(
            formatted.document(), formatted.cached(), formatted.truncated(), formatted.processingTimeMs());
    }
}
