package com.williamcallahan.markdownlabel.domain.render;

import java.util.Locale;
import java.util.Optional;

/**
 * How links are decorated in rendered markup.
 */
public enum LinkStyle {
    /** Links are clickable but look like surrounding text. */
    UNSTYLED,
    /** Links are colored with the link color and underlined. */
    STYLED;

    /**
     * Parses a link style name case-insensitively.
     * @param name style name such as {@code "styled"}
     * @return the style, or empty for null or unrecognized names
     */
    public static Optional<LinkStyle> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException unknownName) {
            return Optional.empty();
        }
    }
}
