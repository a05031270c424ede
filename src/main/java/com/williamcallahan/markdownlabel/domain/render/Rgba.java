package com.williamcallahan.markdownlabel.domain.render;

import java.util.List;
import java.util.Locale;

/**
 * RGBA color with components in the unit interval.
 *
 * @param red red component
 * @param green green component
 * @param blue blue component
 * @param alpha opacity
 */
public record Rgba(double red, double green, double blue, double alpha) {

    public Rgba {
        requireUnit(red, "red");
        requireUnit(green, "green");
        requireUnit(blue, "blue");
        requireUnit(alpha, "alpha");
    }

    /**
     * Builds a color from a four-element component list, as bound from configuration.
     * @param components red, green, blue, alpha
     * @return color
     * @throws IllegalArgumentException when the list does not have four non-null components
     */
    public static Rgba fromComponents(List<Double> components) {
        if (components == null || components.size() != 4) {
            throw new IllegalArgumentException("Color must have exactly 4 components (r, g, b, a): " + components);
        }
        if (components.contains(null)) {
            throw new IllegalArgumentException("Color components cannot be null: " + components);
        }
        return new Rgba(components.get(0), components.get(1), components.get(2), components.get(3));
    }

    /**
     * Formats the color as eight lowercase hex digits, {@code rrggbbaa}, for markup color tags.
     * @return hex string
     */
    public String toHex() {
        return String.format(Locale.ROOT, "%02x%02x%02x%02x",
            toByte(red), toByte(green), toByte(blue), toByte(alpha));
    }

    /**
     * Gets the components as a list, the inverse of {@link #fromComponents(List)}.
     * @return four-element list
     */
    public List<Double> components() {
        return List.of(red, green, blue, alpha);
    }

    private static int toByte(double component) {
        return (int) (component * 255);
    }

    private static void requireUnit(double component, String name) {
        if (Double.isNaN(component) || component < 0.0 || component > 1.0) {
            throw new IllegalArgumentException("Color component " + name + " must be within [0, 1]: " + component);
        }
    }
}
