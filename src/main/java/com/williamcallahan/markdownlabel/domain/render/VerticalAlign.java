package com.williamcallahan.markdownlabel.domain.render;

import java.util.Locale;
import java.util.Optional;

/**
 * Vertical text alignment within a text node's box.
 */
public enum VerticalAlign {
    BOTTOM,
    MIDDLE,
    CENTER,
    TOP;

    /**
     * Parses an alignment name case-insensitively.
     * @param name alignment name such as {@code "top"}
     * @return the alignment, or empty for null or unrecognized names
     */
    public static Optional<VerticalAlign> fromName(String name) {
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
