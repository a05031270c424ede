package com.williamcallahan.markdownlabel.domain.render;

import java.util.Locale;
import java.util.Optional;

/**
 * Horizontal text alignment. {@link #AUTO} follows the base text direction.
 */
public enum HorizontalAlign {
    AUTO,
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    /**
     * Parses an alignment name case-insensitively.
     * @param name alignment name such as {@code "center"}
     * @return the alignment, or empty for null or unrecognized names
     */
    public static Optional<HorizontalAlign> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException unknownName) {
            return Optional.empty();
        }
    }

    /**
     * Gets the lowercase wire name.
     * @return name such as {@code "left"}
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
