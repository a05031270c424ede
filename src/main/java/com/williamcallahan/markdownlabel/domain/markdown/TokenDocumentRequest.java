package com.williamcallahan.markdownlabel.domain.markdown;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Carries a loose token document, its reference definitions and optional style overrides.
 *
 * @param tokens token array in the loose JSON shape, null when absent
 * @param references reference definitions, null when absent
 * @param style style overrides for render requests
 */
public record TokenDocumentRequest(JsonNode tokens, JsonNode references, StyleOverrides style) {

    /**
     * Creates a request, defaulting absent style overrides.
     *
     * @param tokens token array
     * @param references reference definitions
     * @param style style overrides
     * @return request
     */
    @JsonCreator
    public static TokenDocumentRequest create(@JsonProperty("tokens") JsonNode tokens,
                                              @JsonProperty("references") JsonNode references,
                                              @JsonProperty("style") StyleOverrides style) {
        return new TokenDocumentRequest(tokens, references, style == null ? StyleOverrides.none() : style);
    }
}
