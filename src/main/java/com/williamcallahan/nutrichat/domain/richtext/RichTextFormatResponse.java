package com.williamcallahan.nutrichat.domain.richtext;

/**
 * Represents the response variants for the format endpoint.
 */
public sealed interface RichTextFormatResponse permits RichTextFormatOutcome, RichTextErrorResponse {
}
