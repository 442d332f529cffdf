package com.williamcallahan.nutrichat.domain.richtext;

/**
 * Represents the response variants for format cache statistics requests.
 */
public sealed interface RichTextCacheStatsResponse permits RichTextCacheStatsSnapshot, RichTextErrorResponse {}
