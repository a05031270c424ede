package com.williamcallahan.markdownlabel.domain.markdown;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Loose token JSON and reference definitions parsed from Markdown.
 */
public record MarkdownAstOutcome(JsonNode tokens, JsonNode references) {
    public MarkdownAstOutcome {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        Objects.requireNonNull(references, "References cannot be null");
    }
}
