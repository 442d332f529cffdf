package com.williamcallahan.nutrichat.service.richtext;

import com.williamcallahan.nutrichat.domain.richtext.Block;
import com.williamcallahan.nutrichat.domain.richtext.Document;
import com.williamcallahan.nutrichat.domain.richtext.ListItem;
import com.williamcallahan.nutrichat.domain.richtext.ListKind;
import com.williamcallahan.nutrichat.domain.richtext.Span;
import com.williamcallahan.nutrichat.domain.richtext.StyleToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies end-to-end formatting of model replies into documents.
 */
class RichTextFormatterTest {

    private static final StyleToken NO_STYLE = StyleToken.empty();

    private final RichTextFormatter formatter = new RichTextFormatter();

    private static Span.Text text(String content) {
        return new Span.Text(content, NO_STYLE);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void format_nullOrEmpty_returnsEmptyDocument(String input) {
        assertEquals(new Document(List.of()), formatter.format(input, NO_STYLE));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "   ", "\n\n\n", "*", "**", "***", "****", "# ", "#", "---", ":", "\"", "'", "\"\"", "1.", "- ",
        "**a *b", "http://x:", "Intro", "intro:", "• ", "## ****", "\r\n\r\n", "---\n---\n---",
        "'\n'", "1. **\n- *\n# *"
    })
    void format_degenerateInput_neverThrows(String input) {
        Document document = assertDoesNotThrow(() -> formatter.format(input, NO_STYLE));
        assertNotNull(document);
    }

    @Test
    void format_nullStyle_usesEmptyToken() {
        Document document = formatter.format("*calm*", null);

        assertEquals(List.of(new Block.Paragraph(List.of(new Span.Italic("calm", NO_STYLE)), false)),
            document.blocks());
    }

    @Test
    void format_plainText_yieldsOneParagraphWithTrimmedText() {
        String input = "  Leafy greens are rich in iron and folate  ";

        Document document = formatter.format(input);

        assertEquals(1, document.blocks().size());
        Block.Paragraph paragraph = assertInstanceOf(Block.Paragraph.class, document.blocks().get(0));
        assertEquals(input.trim(), paragraph.plainText());
    }

    @Test
    void format_boldOnly_yieldsBoldSpan() {
        assertEquals(List.of(new Block.Paragraph(List.of(new Span.Bold(List.of(text("hello")))), false)),
            formatter.format("**hello**").blocks());
    }

    @Test
    void format_emptyBoldPair_leavesVisibleWord() {
        Document document = formatter.format("**** world");

        assertEquals(1, document.blocks().size());
        assertEquals("world", document.blocks().get(0).plainText());
    }

    @Test
    void format_italicMarkersInsideBold_stayLiteral() {
        assertEquals(List.of(new Block.Paragraph(List.of(new Span.Bold(List.of(text("a *b* c")))), false)),
            formatter.format("**a *b* c**").blocks());
    }

    @Test
    void format_headingWrappedInBold_dropsRedundantBold() {
        assertEquals(List.of(new Block.Heading(1, List.of(text("Title")))), formatter.format("# **Title**").blocks());
    }

    @Test
    void format_listKindChange_yieldsTwoLists() {
        List<Block> blocks = formatter.format("- a\n- b\n1. c").blocks();

        assertEquals(2, blocks.size());
        Block.ListBlock bullets = assertInstanceOf(Block.ListBlock.class, blocks.get(0));
        Block.ListBlock ordered = assertInstanceOf(Block.ListBlock.class, blocks.get(1));
        assertAll(
            () -> assertEquals(ListKind.BULLET, bullets.kind()),
            () -> assertEquals(2, bullets.items().size()),
            () -> assertEquals(ListKind.ORDERED, ordered.kind()),
            () -> assertEquals(1, ordered.items().size()));
    }

    @Test
    void format_sectionHeaderWithBlankLine_suppressesSpacerAndIndents() {
        assertEquals(List.of(
            new Block.SectionHeader(List.of(text("Notes:"))),
            new Block.Paragraph(List.of(text("Body")), true)), formatter.format("Notes:\n\nBody").blocks());
    }

    @Test
    void format_sectionHeaderWithoutBlankLine_matchesSpacedVariant() {
        assertEquals(formatter.format("Notes:\n\nBody"), formatter.format("Notes:\nBody"));
    }

    @Test
    void format_urlEndingInColon_isParagraph() {
        List<Block> blocks = formatter.format("See http://example.com:").blocks();

        assertEquals(List.of(new Block.Paragraph(List.of(text("See http://example.com:")), false)), blocks);
    }

    @Test
    void format_nutritionAnalysis_buildsExpectedStructure() {
        String reply = "Introduction: Here is your daily analysis.\n"
            + "---\n"
            + "## **Daily Summary**\n"
            + "Macros:\n"
            + "- **Protein** 120g\n"
            + "- Carbs 200g\n"
            + "1. Add vegetables\n"
            + "2. Drink water\n"
            + "Your intake looks *balanced*.";

        List<Block> blocks = formatter.format(reply).blocks();

        assertEquals(List.of(
            new Block.Paragraph(List.of(text("Here is your daily analysis.")), false),
            new Block.Spacer(),
            new Block.Heading(2, List.of(text("Daily Summary"))),
            new Block.SectionHeader(List.of(text("Macros:"))),
            new Block.ListBlock(ListKind.BULLET, List.of(
                new ListItem("-", List.of(
                    new Span.Bold(List.of(text("Protein"))), text(" 120g"))),
                new ListItem("-", List.of(text("Carbs 200g"))))),
            new Block.ListBlock(ListKind.ORDERED, List.of(
                new ListItem("1", List.of(text("Add vegetables"))),
                new ListItem("2", List.of(text("Drink water"))))),
            new Block.Paragraph(List.of(
                text("Your intake looks "), new Span.Italic("balanced", NO_STYLE), text(".")), true)), blocks);
    }

    @Test
    void format_quotedReply_stripsQuotesBeforeParsing() {
        assertEquals(List.of(new Block.Paragraph(List.of(text("Stay hydrated")), false)),
            formatter.format("\"Stay hydrated\"").blocks());
    }

    @Test
    void format_baseStyle_reachesEveryLeafSpan() {
        StyleToken style = StyleToken.of(Map.of("fontSize", "16"));

        Document document = formatter.format("# Plan\n- Eat *slowly*\nEnjoy **every** bite", style);

        List<Span> leaves = document.blocks().stream()
            .flatMap(block -> spansOf(block).stream())
            .flatMap(span -> leavesOf(span).stream())
            .toList();
        assertTrue(leaves.size() >= 5);
        for (Span leaf : leaves) {
            StyleToken leafStyle = leaf instanceof Span.Text textSpan ? textSpan.style() : ((Span.Italic) leaf).style();
            assertEquals(style, leafStyle);
        }
    }

    @Test
    void format_concurrentCalls_produceIdenticalDocuments() {
        String reply = "Tips:\n- *Sleep* 8h\n- **Walk** daily\nDone";
        Document expected = formatter.format(reply);

        List<Document> documents = IntStream.range(0, 64).parallel()
            .mapToObj(index -> formatter.format(reply))
            .toList();

        documents.forEach(document -> assertEquals(expected, document));
    }

    private static List<Span> leavesOf(Span span) {
        if (span instanceof Span.Bold bold) {
            return List.copyOf(bold.children());
        }
        return List.of(span);
    }

    private static List<Span> spansOf(Block block) {
        if (block instanceof Block.Heading heading) {
            return heading.text();
        }
        if (block instanceof Block.SectionHeader sectionHeader) {
            return sectionHeader.text();
        }
        if (block instanceof Block.Paragraph paragraph) {
            return paragraph.spans();
        }
        if (block instanceof Block.ListBlock list) {
            return list.items().stream().flatMap(item -> item.spans().stream()).toList();
        }
        return List.of();
    }
}
