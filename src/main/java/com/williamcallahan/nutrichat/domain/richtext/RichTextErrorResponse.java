package com.williamcallahan.nutrichat.domain.richtext;

import java.util.Objects;

/**
 * Error payload shared by the format and document cache endpoints.
 * Renderers show {@code error}; {@code details} names the exception and is empty when none applies.
 *
 * @param error summary of what failed, e.g. {@code "Failed to format rich text"}
 * @param details exception type and message, never null
 */
public record RichTextErrorResponse(String error, String details)
    implements RichTextFormatResponse, RichTextCacheStatsResponse, RichTextCacheClearResponse {
    public RichTextErrorResponse {
        Objects.requireNonNull(error, "Rich text error summary cannot be null");
        details = details == null ? "" : details.strip();
    }
}
