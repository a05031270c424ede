package com.williamcallahan.markdownlabel.domain.markdown;

import java.util.Objects;

/**
 * Markdown written back from a token document.
 */
public record MarkdownSerializeOutcome(String markdown, int tokenCount) {
    public MarkdownSerializeOutcome {
        Objects.requireNonNull(markdown, "Markdown cannot be null");
        if (tokenCount < 0) {
            throw new IllegalArgumentException("Token count must be non-negative");
        }
    }
}
