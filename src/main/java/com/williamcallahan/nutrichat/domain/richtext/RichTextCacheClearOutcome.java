package com.williamcallahan.nutrichat.domain.richtext;

import java.util.Objects;

/**
 * Confirms that every cached document was discarded and will be formatted again on next request.
 *
 * @param status {@code "success"} once the cache is empty
 * @param message human-readable confirmation
 */
public record RichTextCacheClearOutcome(String status, String message) implements RichTextCacheClearResponse {

    private static final String SUCCESS_STATUS = "success";
    private static final String CLEARED_MESSAGE = "Cache cleared successfully";

    public RichTextCacheClearOutcome {
        Objects.requireNonNull(status, "Document cache clear status cannot be null");
        Objects.requireNonNull(message, "Document cache clear message cannot be null");
    }

    public static RichTextCacheClearOutcome cleared() {
        return new RichTextCacheClearOutcome(SUCCESS_STATUS, CLEARED_MESSAGE);
    }
}
