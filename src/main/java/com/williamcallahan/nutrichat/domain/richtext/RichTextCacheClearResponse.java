package com.williamcallahan.nutrichat.domain.richtext;

/**
 * Represents the response variants for format cache clear requests.
 */
public sealed interface RichTextCacheClearResponse
    permits RichTextCacheClearOutcome, RichTextErrorResponse {
}
