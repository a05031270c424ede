package com.williamcallahan.markdownlabel.domain.markdown;

import com.williamcallahan.markdownlabel.domain.render.VisualNode;

import java.util.Objects;

/**
 * Describes the visual tree produced for one render request.
 */
public record MarkdownRenderOutcome(VisualNode tree, int tokenCount, String source) {
    public MarkdownRenderOutcome {
        Objects.requireNonNull(tree, "Visual tree cannot be null");
        Objects.requireNonNull(source, "Render source cannot be null");
        if (tokenCount < 0) {
            throw new IllegalArgumentException("Token count must be non-negative");
        }
    }
}
