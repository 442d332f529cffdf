package com.williamcallahan.nutrichat.domain.richtext;

import java.util.Locale;
import java.util.Objects;

/**
 * Point-in-time counters of the formatted document cache, as reported to operators.
 *
 * @param hitCount requests answered with an already formatted document
 * @param missCount requests that ran the formatter
 * @param evictionCount documents dropped for size or age
 * @param size approximate number of cached documents
 * @param hitRate hit percentage with two decimals, e.g. {@code "50.00%"}
 */
public record RichTextCacheStatsSnapshot(
    long hitCount,
    long missCount,
    long evictionCount,
    long size,
    String hitRate
) implements RichTextCacheStatsResponse {
    public RichTextCacheStatsSnapshot {
        Objects.requireNonNull(hitRate, "Document cache hit rate cannot be null");
        if (hitCount < 0 || missCount < 0 || evictionCount < 0 || size < 0) {
            throw new IllegalArgumentException("Document cache counters cannot be negative");
        }
    }

    /**
     * Builds a snapshot, rendering the hit ratio as a percentage.
     *
     * @param hitCount cache hits
     * @param missCount cache misses
     * @param evictionCount cache evictions
     * @param size cached document count
     * @param hitRatio hits divided by requests, between 0 and 1
     * @return snapshot for the stats endpoint
     */
    public static RichTextCacheStatsSnapshot of(long hitCount, long missCount, long evictionCount, long size,
                                                double hitRatio) {
        String hitRate = String.format(Locale.ROOT, "%.2f%%", hitRatio * 100);
        return new RichTextCacheStatsSnapshot(hitCount, missCount, evictionCount, size, hitRate);
    }
}
