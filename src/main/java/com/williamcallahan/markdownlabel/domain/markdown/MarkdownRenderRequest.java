package com.williamcallahan.markdownlabel.domain.markdown;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Accepts raw Markdown input with optional style overrides.
 */
public record MarkdownRenderRequest(String content, StyleOverrides style) {

    /**
     * Creates a request while normalizing null content to an empty string.
     *
     * @param content markdown input text
     * @param style style overrides, may be absent
     * @return normalized render request
     */
    @JsonCreator
    public static MarkdownRenderRequest create(@JsonProperty("content") String content,
                                               @JsonProperty("style") StyleOverrides style) {
        return new MarkdownRenderRequest(content == null ? "" : content, style == null ? StyleOverrides.none() : style);
    }

    public MarkdownRenderRequest {
        Objects.requireNonNull(content, "Markdown content cannot be null");
        Objects.requireNonNull(style, "Style overrides cannot be null");
    }

    /**
     * Indicates whether the request contains any non-blank markdown.
     *
     * @return true when the content is blank
     */
    public boolean isBlank() {
        return content.isBlank();
    }
}
