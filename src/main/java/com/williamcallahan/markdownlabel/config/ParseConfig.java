package com.williamcallahan.markdownlabel.config;

import java.util.Locale;

/**
 * Limits applied before Markdown reaches the parser.
 */
public class ParseConfig {

    private static final int MAX_INPUT_LENGTH_DEF = 100_000;
    private static final int MIN_POSITIVE = 1;
    private static final String MAX_INPUT_LENGTH_KEY = "markdown.parse.max-input-length";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int maxInputLength = MAX_INPUT_LENGTH_DEF;

    public ParseConfig() {}

    /**
     * Validates parse limits.
     */
    public void validateConfiguration() {
        if (maxInputLength < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_INPUT_LENGTH_KEY));
        }
    }

    public int getMaxInputLength() {
        return maxInputLength;
    }

    public void setMaxInputLength(final int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }
}
