package com.williamcallahan.markdownlabel.domain.render;

/**
 * Insets applied inside a container, in layout units.
 *
 * @param left left inset
 * @param top top inset
 * @param right right inset
 * @param bottom bottom inset
 */
public record Padding(double left, double top, double right, double bottom) {

    public static final Padding NONE = new Padding(0, 0, 0, 0);

    /**
     * Creates equal padding on all four sides.
     * @param inset inset for every side
     * @return padding
     */
    public static Padding uniform(double inset) {
        return new Padding(inset, inset, inset, inset);
    }
}
