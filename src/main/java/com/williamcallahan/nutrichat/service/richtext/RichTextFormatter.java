package com.williamcallahan.nutrichat.service.richtext;

import com.williamcallahan.nutrichat.domain.richtext.Document;
import com.williamcallahan.nutrichat.domain.richtext.StyleToken;

/**
 * Converts language-model prose (chat replies, nutrition analyses) into a typed document.
 *
 * <p>Formatting is total and side-effect free: any string, including null, malformed or
 * adversarial markup, yields a document. Unmatched delimiters are dropped rather than reported.
 * Instances hold no mutable state and may be shared across threads.</p>
 */
public class RichTextFormatter {

    /**
     * Formats text with the default base style.
     *
     * @param rawText text to format, may be null
     * @return formatted document, empty for null or empty input
     */
    public Document format(String rawText) {
        return format(rawText, StyleToken.empty());
    }

    /**
     * Normalizes the text once, then parses it into blocks and inline spans.
     *
     * @param rawText text to format, may be null
     * @param baseStyle style threaded into every leaf span, defaults to an empty token when null
     * @return formatted document, empty for null or empty input
     */
    public Document format(String rawText, StyleToken baseStyle) {
        if (rawText == null || rawText.isEmpty()) {
            return Document.empty();
        }
        StyleToken style = baseStyle == null ? StyleToken.empty() : baseStyle;
        String normalizedText = RichTextNormalizer.normalize(rawText);
        return new Document(BlockParser.parse(normalizedText, style));
    }
}
