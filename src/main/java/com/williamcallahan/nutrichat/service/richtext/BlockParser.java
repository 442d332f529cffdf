package com.williamcallahan.nutrichat.service.richtext;

import com.williamcallahan.nutrichat.domain.richtext.Block;
import com.williamcallahan.nutrichat.domain.richtext.ListItem;
import com.williamcallahan.nutrichat.domain.richtext.ListKind;
import com.williamcallahan.nutrichat.domain.richtext.Span;
import com.williamcallahan.nutrichat.domain.richtext.StyleToken;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies normalized text line by line into document blocks.
 *
 * <p>Rules are checked in a fixed order: blank line, section header, heading, list item,
 * paragraph. A line carrying a {@code #} heading prefix is never a section header. Header and
 * heading text is kept literal; only list items and paragraphs are parsed for emphasis. All scan
 * state lives in local variables of {@link #parse(String, StyleToken)}.</p>
 */
final class BlockParser {
    private BlockParser() {}

    private static final String URL_SCHEME_SEPARATOR = "://";
    private static final String SECTION_TITLE_SUFFIX = ":";
    private static final int MAX_HEADING_LEVEL = 3;

    private static final Pattern BULLET_ITEM = Pattern.compile("([*\\-\u2022])\\s(.+)");
    private static final Pattern ORDERED_ITEM = Pattern.compile("(\\d+)\\.\\s(.+)");
    private static final Pattern REDUNDANT_HEADING_BOLD = Pattern.compile("^\\*\\*(.*)\\*\\*$");

    /**
     * Parses normalized text into blocks.
     *
     * @param normalizedText output of the normalizer
     * @param style base style threaded into inline spans
     * @return blocks in reading order, empty for empty input
     */
    static List<Block> parse(String normalizedText, StyleToken style) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return List.of();
        }
        List<Block> blocks = new ArrayList<>();
        ListAccumulator openList = new ListAccumulator();
        boolean lastLineWasHeader = false;
        // Sticky: never reset, so every later paragraph is indented even outside the section.
        boolean inSection = false;

        for (String rawLine : normalizedText.split("\n", -1)) {
            String line = RichTextNormalizer.trimLine(rawLine);

            if (line.isEmpty()) {
                openList.flushInto(blocks);
                if (lastLineWasHeader) {
                    lastLineWasHeader = false;
                } else {
                    blocks.add(new Block.Spacer());
                }
                continue;
            }

            int headingLevel = headingLevel(line);

            if (headingLevel == 0 && isSectionHeader(line)) {
                openList.flushInto(blocks);
                blocks.add(new Block.SectionHeader(literalText(line, style)));
                lastLineWasHeader = true;
                inSection = true;
                continue;
            }

            if (headingLevel > 0) {
                openList.flushInto(blocks);
                String headingText = stripRedundantBold(line.substring(headingLevel + 1));
                blocks.add(new Block.Heading(headingLevel, literalText(headingText, style)));
                lastLineWasHeader = true;
                continue;
            }

            Matcher bulletMatcher = BULLET_ITEM.matcher(line);
            Matcher orderedMatcher = ORDERED_ITEM.matcher(line);
            ListKind itemKind = null;
            Matcher itemMatcher = null;
            if (bulletMatcher.matches()) {
                itemKind = ListKind.BULLET;
                itemMatcher = bulletMatcher;
            } else if (orderedMatcher.matches()) {
                itemKind = ListKind.ORDERED;
                itemMatcher = orderedMatcher;
            }
            if (itemKind != null) {
                List<Span> itemSpans = InlineStyleParser.parse(itemMatcher.group(2), style);
                openList.append(itemKind, new ListItem(itemMatcher.group(1), itemSpans), blocks);
                lastLineWasHeader = false;
                continue;
            }

            openList.flushInto(blocks);
            blocks.add(new Block.Paragraph(InlineStyleParser.parse(line, style), inSection));
            lastLineWasHeader = false;
        }

        openList.flushInto(blocks);
        return blocks;
    }

    static int headingLevel(String line) {
        int hashCount = 0;
        while (hashCount < line.length() && hashCount <= MAX_HEADING_LEVEL && line.charAt(hashCount) == '#') {
            hashCount++;
        }
        if (hashCount == 0 || hashCount > MAX_HEADING_LEVEL) {
            return 0;
        }
        if (hashCount >= line.length() || line.charAt(hashCount) != ' ') {
            return 0;
        }
        return hashCount;
    }

    static boolean isSectionHeader(String line) {
        return line.endsWith(SECTION_TITLE_SUFFIX) && !line.contains(URL_SCHEME_SEPARATOR);
    }

    private static String stripRedundantBold(String headingText) {
        Matcher boldMatcher = REDUNDANT_HEADING_BOLD.matcher(headingText);
        return boldMatcher.matches() ? boldMatcher.group(1) : headingText;
    }

    private static List<Span> literalText(String text, StyleToken style) {
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(new Span.Text(text, style));
    }

    /**
     * Items of the list currently being built. Created per parse call.
     */
    private static final class ListAccumulator {
        private ListKind kind;
        private final List<ListItem> items = new ArrayList<>();

        void append(ListKind itemKind, ListItem item, List<Block> blocks) {
            if (kind != itemKind) {
                flushInto(blocks);
                kind = itemKind;
            }
            items.add(item);
        }

        void flushInto(List<Block> blocks) {
            if (kind != null && !items.isEmpty()) {
                blocks.add(new Block.ListBlock(kind, items));
            }
            kind = null;
            items.clear();
        }
    }
}
