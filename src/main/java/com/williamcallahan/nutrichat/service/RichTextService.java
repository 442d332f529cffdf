package com.williamcallahan.nutrichat.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.nutrichat.config.AppProperties;
import com.williamcallahan.nutrichat.domain.richtext.Document;
import com.williamcallahan.nutrichat.domain.richtext.FormattedRichText;
import com.williamcallahan.nutrichat.domain.richtext.StyleToken;
import com.williamcallahan.nutrichat.service.richtext.RichTextFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Formats chat replies and nutrition analyses for the presentation layer.
 * Bounds input length and caches documents per text and base style; the documents are
 * immutable, so cached instances are shared between callers.
 */
@Service
public class RichTextService {

    private static final Logger logger = LoggerFactory.getLogger(RichTextService.class);

    private final RichTextFormatter formatter;
    private final Cache<FormatCacheKey, Document> documentCache;
    private final int maxInputLength;

    @Autowired
    public RichTextService(AppProperties appProperties) {
        this(new RichTextFormatter(), appProperties);
    }

    RichTextService(RichTextFormatter formatter, AppProperties appProperties) {
        AppProperties.Formatter formatterProperties = appProperties.getFormatter();
        this.formatter = formatter;
        this.maxInputLength = formatterProperties.getMaxInputLength();
        this.documentCache = Caffeine.newBuilder()
            .maximumSize(formatterProperties.getCacheSize())
            .expireAfterWrite(formatterProperties.getCacheTtl())
            .recordStats()
            .build();

        logger.info("RichTextService initialized (maxInputLength={}, cacheSize={}, cacheTtl={})",
            maxInputLength, formatterProperties.getCacheSize(), formatterProperties.getCacheTtl());
    }

    /**
     * Formats text with the default base style.
     *
     * @param rawText text to format, may be null
     * @return formatted document with processing metadata
     */
    public FormattedRichText format(String rawText) {
        return format(rawText, StyleToken.empty());
    }

    /**
     * Formats text, serving repeated inputs from the cache.
     *
     * @param rawText text to format, may be null
     * @param baseStyle style threaded into every leaf span, may be null
     * @return formatted document with processing metadata
     */
    public FormattedRichText format(String rawText, StyleToken baseStyle) {
        if (rawText == null || rawText.isEmpty()) {
            return new FormattedRichText(Document.empty(), false, false, 0L);
        }
        long startTime = System.currentTimeMillis();
        StyleToken style = baseStyle == null ? StyleToken.empty() : baseStyle;

        boolean truncated = rawText.length() > maxInputLength;
        String boundedText = rawText;
        if (truncated) {
            logger.warn("Rich text input exceeds maximum length: {} > {}", rawText.length(), maxInputLength);
            int cutIndex = maxInputLength;
            if (Character.isHighSurrogate(rawText.charAt(cutIndex - 1))) {
                cutIndex--;
            }
            boundedText = rawText.substring(0, cutIndex);
        }

        FormatCacheKey cacheKey = new FormatCacheKey(boundedText, style);
        Document cached = documentCache.getIfPresent(cacheKey);
        if (cached != null) {
            logger.debug("Cache hit for rich text formatting");
            return new FormattedRichText(cached, true, truncated, System.currentTimeMillis() - startTime);
        }

        Document document = formatter.format(boundedText, style);
        documentCache.put(cacheKey, document);

        long processingTime = System.currentTimeMillis() - startTime;
        logger.debug("Formatted rich text in {}ms: {} blocks", processingTime, document.blocks().size());
        return new FormattedRichText(document, false, truncated, processingTime);
    }

    /**
     * Gets cache statistics for monitoring.
     *
     * @return cache statistics
     */
    public CacheStats getCacheStats() {
        var stats = documentCache.stats();
        return new CacheStats(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            documentCache.estimatedSize()
        );
    }

    /**
     * Clears the formatted document cache.
     */
    public void clearCache() {
        documentCache.invalidateAll();
        logger.info("Rich text document cache cleared");
    }

    /**
     * Cache statistics record.
     */
    public record CacheStats(
        long hitCount,
        long missCount,
        long evictionCount,
        long size
    ) {
        public double hitRate() {
            long total = hitCount + missCount;
            return total == 0 ? 0.0 : (double) hitCount / total;
        }
    }

    private record FormatCacheKey(String text, StyleToken style) {}
}
