package com.williamcallahan.nutrichat.service.richtext;

import java.util.regex.Pattern;

/**
 * Cleans language-model formatting noise from raw text before block parsing.
 * Applied exactly once per formatting call; the output is not guaranteed stable under a second pass.
 */
final class RichTextNormalizer {
    private RichTextNormalizer() {}

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
    private static final Pattern LEADING_INTRODUCTION =
        Pattern.compile("^(?:introduction|intro)\\b:?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern WRAPPING_QUOTES = Pattern.compile("^\\s*([\"'])(.+)\\1\\s*$", Pattern.DOTALL);

    // Applied in order; each one sees the output of the previous
    private static final Pattern DOUBLE_QUOTED_LINE = Pattern.compile("^\"(.+)\"$", Pattern.MULTILINE);
    private static final Pattern LEADING_DOUBLE_QUOTE = Pattern.compile("^\"(.+)$", Pattern.MULTILINE);
    private static final Pattern TRAILING_DOUBLE_QUOTE = Pattern.compile("^(.+)\"$", Pattern.MULTILINE);
    private static final Pattern SINGLE_QUOTED_LINE = Pattern.compile("^'(.+)'$", Pattern.MULTILINE);
    private static final Pattern STANDALONE_DOUBLE_QUOTED = Pattern.compile("^\"([^\"]+?)\"$", Pattern.MULTILINE);
    private static final Pattern STANDALONE_SINGLE_QUOTED = Pattern.compile("^'([^']+?)'$", Pattern.MULTILINE);

    private static final Pattern DIVIDER_BETWEEN_LINES = Pattern.compile("\\n---\\n");
    private static final Pattern DIVIDER_AT_START = Pattern.compile("\\A---\\n");
    private static final Pattern DIVIDER_AT_END = Pattern.compile("\\n---\\z");
    private static final Pattern DIVIDER_ONLY = Pattern.compile("\\A---\\z");
    private static final Pattern DIVIDER_WITH_WHITESPACE = Pattern.compile("\\n\\s*---\\s*\\n");
    private static final Pattern DIVIDER_STANDALONE = Pattern.compile("(?<=\\n)---(?=\\n)");

    /**
     * Rewrites raw model output into text the block parser can classify line by line.
     *
     * @param rawText text as produced upstream, may be null
     * @return normalized text, empty when the input is null or empty
     */
    static String normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }
        String normalizedText = LINE_BREAK.matcher(rawText).replaceAll("\n");
        normalizedText = LEADING_INTRODUCTION.matcher(normalizedText).replaceFirst("");
        normalizedText = WRAPPING_QUOTES.matcher(normalizedText).replaceFirst("$2");
        normalizedText = stripLineQuotes(normalizedText);
        normalizedText = collapseDividers(normalizedText);
        return spaceAfterSectionTitles(normalizedText);
    }

    static String stripLineQuotes(String text) {
        String strippedText = DOUBLE_QUOTED_LINE.matcher(text).replaceAll("$1");
        strippedText = LEADING_DOUBLE_QUOTE.matcher(strippedText).replaceAll("$1");
        strippedText = TRAILING_DOUBLE_QUOTE.matcher(strippedText).replaceAll("$1");
        strippedText = SINGLE_QUOTED_LINE.matcher(strippedText).replaceAll("$1");
        strippedText = STANDALONE_DOUBLE_QUOTED.matcher(strippedText).replaceAll("$1");
        return STANDALONE_SINGLE_QUOTED.matcher(strippedText).replaceAll("$1");
    }

    static String collapseDividers(String text) {
        String collapsedText = DIVIDER_BETWEEN_LINES.matcher(text).replaceAll("\n\n");
        collapsedText = DIVIDER_AT_START.matcher(collapsedText).replaceFirst("\n");
        collapsedText = DIVIDER_AT_END.matcher(collapsedText).replaceFirst("\n");
        collapsedText = DIVIDER_ONLY.matcher(collapsedText).replaceFirst("");
        collapsedText = DIVIDER_WITH_WHITESPACE.matcher(collapsedText).replaceAll("\n\n");
        return DIVIDER_STANDALONE.matcher(collapsedText).replaceAll("");
    }

    // A title already followed by a blank line, or ending the text, gets no extra gap
    static String spaceAfterSectionTitles(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder spacedBuilder = new StringBuilder(text.length() + 16);
        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            String line = lines[lineIndex];
            spacedBuilder.append(line);
            if (lineIndex + 1 < lines.length) {
                spacedBuilder.append('\n');
                if (isSectionTitle(line) && !trimLine(lines[lineIndex + 1]).isEmpty()) {
                    spacedBuilder.append('\n');
                }
            }
        }
        return spacedBuilder.toString();
    }

    /**
     * Trims a line the way chat clients do, treating no-break spaces and byte order marks as
     * whitespace alongside the characters {@link String#strip()} removes.
     *
     * @param line line to trim
     * @return line without edge whitespace
     */
    static String trimLine(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && isTrimmable(line.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(start, end);
    }

    private static boolean isTrimmable(char character) {
        return Character.isWhitespace(character) || Character.isSpaceChar(character) || character == BYTE_ORDER_MARK;
    }

    private static boolean isSectionTitle(String line) {
        return !line.isEmpty() && line.endsWith(":");
    }
}
