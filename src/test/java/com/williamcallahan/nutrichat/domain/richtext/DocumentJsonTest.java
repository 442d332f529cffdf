package com.williamcallahan.nutrichat.domain.richtext;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies the JSON shape renderers consume.
 */
class DocumentJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    @Test
    void blocksAndSpansCarryTypeDiscriminators() throws Exception {
        StyleToken style = StyleToken.of(Map.of("fontSize", "16"));
        Document document = new Document(List.of(
            new Block.Heading(2, List.of(new Span.Text("Summary", style))),
            new Block.Spacer(),
            new Block.Paragraph(List.of(
                new Span.Bold(List.of(new Span.Text("Protein", style))),
                new Span.Italic("daily", style)), true)
        ));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(document));

        JsonNode blocks = json.get("blocks");
        assertEquals("heading", blocks.get(0).get("type").asText());
        assertEquals(2, blocks.get(0).get("level").asInt());
        assertEquals("spacer", blocks.get(1).get("type").asText());
        assertEquals("paragraph", blocks.get(2).get("type").asText());
        assertTrue(blocks.get(2).get("indented").asBoolean());

        JsonNode bold = blocks.get(2).get("spans").get(0);
        assertEquals("bold", bold.get("type").asText());
        assertEquals("16", bold.get("children").get(0).get("style").get("fontSize").asText());
        assertEquals("italic", blocks.get(2).get("spans").get(1).get("type").asText());
        assertFalse(json.has("empty"));
    }

    @Test
    void listKindSerializesLowercase() throws Exception {
        Block list = new Block.ListBlock(ListKind.ORDERED, List.of(
            new ListItem("1", List.of(new Span.Text("Oats", StyleToken.empty())))));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(list));

        assertEquals("list", json.get("type").asText());
        assertEquals("ordered", json.get("kind").asText());
        assertEquals("1", json.get("items").get(0).get("marker").asText());
    }

    @Test
    void styleTokenRoundTripsAsPlainObject() throws Exception {
        StyleToken style = StyleToken.of(Map.of("color", "white"));

        String json = objectMapper.writeValueAsString(style);

        assertEquals("{\"color\":\"white\"}", json);
        assertEquals(style, objectMapper.readValue(json, StyleToken.class));
    }

    @Test
    void formatRequestDefaultsMissingFields() throws Exception {
        RichTextFormatRequest request = objectMapper.readValue("{}", RichTextFormatRequest.class);

        assertEquals("", request.text());
        assertTrue(request.baseStyle().isEmpty());
    }
}
