package com.williamcallahan.nutrichat.service.richtext;

import com.williamcallahan.nutrichat.domain.richtext.Span;
import com.williamcallahan.nutrichat.domain.richtext.StyleToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line into text, bold and italic spans.
 *
 * <p>Two discrete passes run over a flat span list: the first pairs {@code **} delimiters into
 * bold spans, the second pairs {@code *} delimiters inside the remaining text fragments only.
 * Bold content is never rescanned, so {@code **a *b* c**} stays a single bold run.</p>
 *
 * <p>Delimiters alternate between opening and closing roles. An empty pair is dropped, and an
 * opener without a partner loses its delimiter while the text after it is kept as plain text.</p>
 */
final class InlineStyleParser {
    private InlineStyleParser() {}

    private static final String BOLD_DELIMITER = "**";
    private static final String ITALIC_DELIMITER = "*";

    /**
     * Parses inline emphasis in a single line.
     *
     * @param line line content without block markers
     * @param style base style threaded into every leaf span
     * @return spans in left-to-right order, empty when the line has no visible content
     */
    static List<Span> parse(String line, StyleToken style) {
        if (line == null || line.isEmpty()) {
            return List.of();
        }
        StyleToken baseStyle = style == null ? StyleToken.empty() : style;
        List<Span> boldPass = pairBoldDelimiters(line, baseStyle);
        List<Span> italicPass = pairItalicDelimiters(boldPass, baseStyle);
        return List.copyOf(trimOuterWhitespace(italicPass, baseStyle));
    }

    static List<Span> pairBoldDelimiters(String line, StyleToken style) {
        List<Span> spans = new ArrayList<>();
        if (!line.contains(BOLD_DELIMITER)) {
            spans.add(new Span.Text(line, style));
            return spans;
        }
        int cursor = 0;
        int openIndex = -1;
        while (cursor < line.length()) {
            int delimiterIndex = line.indexOf(BOLD_DELIMITER, cursor);
            if (delimiterIndex < 0) {
                addText(spans, line.substring(cursor), style);
                break;
            }
            if (openIndex < 0) {
                addText(spans, line.substring(cursor, delimiterIndex), style);
                openIndex = delimiterIndex;
            } else {
                String boldContent = line.substring(openIndex + BOLD_DELIMITER.length(), delimiterIndex);
                if (!boldContent.isEmpty()) {
                    spans.add(new Span.Bold(List.of(new Span.Text(boldContent, style))));
                }
                openIndex = -1;
            }
            cursor = delimiterIndex + BOLD_DELIMITER.length();
        }
        return spans;
    }

    static List<Span> pairItalicDelimiters(List<Span> spans, StyleToken style) {
        List<Span> italicSpans = new ArrayList<>(spans.size());
        for (Span span : spans) {
            if (span instanceof Span.Text textSpan) {
                italicSpans.addAll(splitItalics(textSpan.text(), style));
            } else {
                italicSpans.add(span);
            }
        }
        return italicSpans;
    }

    private static List<Span> splitItalics(String text, StyleToken style) {
        List<Span> spans = new ArrayList<>();
        if (!text.contains(ITALIC_DELIMITER)) {
            spans.add(new Span.Text(text, style));
            return spans;
        }
        int cursor = 0;
        int openIndex = -1;
        while (cursor < text.length()) {
            int delimiterIndex = text.indexOf(ITALIC_DELIMITER, cursor);
            if (delimiterIndex < 0) {
                addText(spans, text.substring(cursor), style);
                break;
            }
            if (openIndex < 0) {
                addText(spans, text.substring(cursor, delimiterIndex), style);
                openIndex = delimiterIndex;
            } else {
                String italicContent = text.substring(openIndex + ITALIC_DELIMITER.length(), delimiterIndex);
                if (!italicContent.isEmpty()) {
                    spans.add(new Span.Italic(italicContent, style));
                }
                openIndex = -1;
            }
            cursor = delimiterIndex + ITALIC_DELIMITER.length();
        }
        return spans;
    }

    // Dropped delimiters can leave whitespace at the edges, e.g. "**** world"
    private static List<Span> trimOuterWhitespace(List<Span> spans, StyleToken style) {
        List<Span> trimmedSpans = new ArrayList<>(spans);
        if (!trimmedSpans.isEmpty() && trimmedSpans.get(0) instanceof Span.Text firstText) {
            String leadingTrimmed = firstText.text().stripLeading();
            replaceOrRemove(trimmedSpans, 0, leadingTrimmed, firstText, style);
        }
        int lastIndex = trimmedSpans.size() - 1;
        if (lastIndex >= 0 && trimmedSpans.get(lastIndex) instanceof Span.Text lastText) {
            String trailingTrimmed = lastText.text().stripTrailing();
            replaceOrRemove(trimmedSpans, lastIndex, trailingTrimmed, lastText, style);
        }
        return trimmedSpans;
    }

    private static void replaceOrRemove(List<Span> spans, int index, String trimmedText,
                                        Span.Text original, StyleToken style) {
        if (trimmedText.isEmpty()) {
            spans.remove(index);
        } else if (trimmedText.length() != original.text().length()) {
            spans.set(index, new Span.Text(trimmedText, style));
        }
    }

    private static void addText(List<Span> spans, String text, StyleToken style) {
        if (!text.isEmpty()) {
            spans.add(new Span.Text(text, style));
        }
    }
}
