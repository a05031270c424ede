package com.williamcallahan.markdownlabel.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Bounds of the parsed-document cache.
 */
public class ParseCacheConfig {

    private static final long MAX_SIZE_DEF = 500L;
    private static final Duration EXPIRE_DEF = Duration.ofMinutes(30);
    private static final long MIN_NON_NEG = 0L;
    private static final String MAX_SIZE_KEY = "markdown.cache.maximum-size";
    private static final String EXPIRE_KEY = "markdown.cache.expire-after-write";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String POSITIVE_DURATION_FMT = "%s must be a positive duration.";

    private long maximumSize = MAX_SIZE_DEF;
    private Duration expireAfterWrite = EXPIRE_DEF;

    public ParseCacheConfig() {}

    /**
     * Validates cache bounds.
     */
    public void validateConfiguration() {
        if (maximumSize < MIN_NON_NEG) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, MAX_SIZE_KEY));
        }
        if (expireAfterWrite == null || expireAfterWrite.isZero() || expireAfterWrite.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_DURATION_FMT, EXPIRE_KEY));
        }
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(final long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public Duration getExpireAfterWrite() {
        return expireAfterWrite;
    }

    public void setExpireAfterWrite(final Duration expireAfterWrite) {
        this.expireAfterWrite = expireAfterWrite;
    }
}
