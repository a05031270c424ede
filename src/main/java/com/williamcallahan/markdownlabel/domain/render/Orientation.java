package com.williamcallahan.markdownlabel.domain.render;

/**
 * Stacking direction of a container's children.
 */
public enum Orientation {
    VERTICAL,
    HORIZONTAL
}
