package com.williamcallahan.markdownlabel.domain.markdown;

import java.util.Locale;
import java.util.Objects;

/**
 * Captures statistics of the parsed-document cache.
 */
public record MarkdownCacheStatsSnapshot(
    long hitCount,
    long missCount,
    long evictionCount,
    long size,
    String hitRate
) {
    public MarkdownCacheStatsSnapshot {
        Objects.requireNonNull(hitRate, "Hit rate string cannot be null");
        if (hitCount < 0 || missCount < 0 || evictionCount < 0 || size < 0) {
            throw new IllegalArgumentException("Cache stats must be non-negative");
        }
    }

    /**
     * Builds a snapshot, formatting the hit rate as a percentage with two decimals.
     *
     * @param hitCount cache hits
     * @param missCount cache misses
     * @param evictionCount evicted entries
     * @param size estimated entry count
     * @return snapshot
     */
    public static MarkdownCacheStatsSnapshot of(long hitCount, long missCount, long evictionCount, long size) {
        long total = hitCount + missCount;
        double rate = total == 0 ? 0.0 : (double) hitCount / total;
        return new MarkdownCacheStatsSnapshot(hitCount, missCount, evictionCount, size,
            String.format(Locale.ROOT, "%.2f%%", rate * 100));
    }
}
