package com.williamcallahan.nutrichat.web;

import com.williamcallahan.nutrichat.domain.richtext.FormattedRichText;
import com.williamcallahan.nutrichat.domain.richtext.RichTextCacheClearOutcome;
import com.williamcallahan.nutrichat.domain.richtext.RichTextCacheClearResponse;
import com.williamcallahan.nutrichat.domain.richtext.RichTextCacheStatsResponse;
import com.williamcallahan.nutrichat.domain.richtext.RichTextCacheStatsSnapshot;
import com.williamcallahan.nutrichat.domain.richtext.RichTextFormatOutcome;
import com.williamcallahan.nutrichat.domain.richtext.RichTextFormatRequest;
import com.williamcallahan.nutrichat.domain.richtext.RichTextFormatResponse;
import com.williamcallahan.nutrichat.service.RichTextService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller that turns model-generated chat and analysis text into typed documents
 * for the mobile presentation layer.
 */
@RestController
@RequestMapping("/api/richtext")
public class RichTextController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(RichTextController.class);

    private final RichTextService richTextService;

    public RichTextController(RichTextService richTextService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.richTextService = richTextService;
    }

    /**
     * Formats text into a document of blocks and inline spans.
     *
     * @param request A JSON object with the text to format and an optional base style. Expected format:
     *                <pre>{@code
     *                  {
     *                    "text": "Notes:\n\n**Protein** keeps you full.",
     *                    "baseStyle": {"fontSize": "16"}
     *                  }
     *                }</pre>
     * @return the formatted document with cache and timing metadata
     */
    @PostMapping(value = "/format",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<? extends RichTextFormatResponse> format(@RequestBody RichTextFormatRequest request) {
        try {
            logger.debug("Formatting rich text of length: {}", request.text().length());
            FormattedRichText formatted = richTextService.format(request.text(), request.baseStyle());
            return ResponseEntity.ok(RichTextFormatOutcome.from(formatted));
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected rich text request: {}", e.getMessage());
            return handleValidationException(e);
        } catch (Exception e) {
            logger.error("Error formatting rich text", e);
            return handleServiceException(e, "format rich text");
        }
    }

    /**
     * Retrieves statistics about the formatted document cache.
     *
     * @return hit count, miss count, eviction count, size and hit rate
     */
    @GetMapping(value = "/cache/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<? extends RichTextCacheStatsResponse> getCacheStats() {
        try {
            var stats = richTextService.getCacheStats();
            return ResponseEntity.ok(RichTextCacheStatsSnapshot.of(
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                stats.size(),
                stats.hitRate()
            ));
        } catch (Exception e) {
            logger.error("Error getting cache stats", e);
            return handleServiceException(e, "get cache stats");
        }
    }

    /**
     * Clears the formatted document cache.
     *
     * @return status message
     */
    @PostMapping(value = "/cache/clear", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<? extends RichTextCacheClearResponse> clearCache() {
        try {
            richTextService.clearCache();
            logger.info("Rich text cache cleared via API");
            return ResponseEntity.ok(RichTextCacheClearOutcome.cleared());
        } catch (Exception e) {
            logger.error("Error clearing cache", e);
            return handleServiceException(e, "clear cache");
        }
    }
}
