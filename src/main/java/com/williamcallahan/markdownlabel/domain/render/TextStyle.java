package com.williamcallahan.markdownlabel.domain.render;

import java.util.Objects;

/**
 * Resolved styling of one text node.
 *
 * @param fontName font used for the run
 * @param fontSize absolute font size
 * @param fontScale multiplier of the base size that produced {@code fontSize}
 * @param color text color
 * @param bold whether text is bold
 * @param italic whether text is italic
 * @param horizontalAlign horizontal alignment, never {@link HorizontalAlign#AUTO}
 * @param verticalAlign vertical alignment
 * @param lineHeight line height multiplier
 * @param markup whether the text contains markup tags to interpret
 * @param widthConstraint wrapping width, null for unconstrained
 * @param fixedWidth fixed node width, null when the node stretches
 */
public record TextStyle(
    String fontName,
    double fontSize,
    double fontScale,
    Rgba color,
    boolean bold,
    boolean italic,
    HorizontalAlign horizontalAlign,
    VerticalAlign verticalAlign,
    double lineHeight,
    boolean markup,
    Double widthConstraint,
    Double fixedWidth
) {
    public TextStyle {
        Objects.requireNonNull(fontName, "Font name cannot be null");
        Objects.requireNonNull(color, "Text color cannot be null");
        Objects.requireNonNull(horizontalAlign, "Horizontal alignment cannot be null");
        Objects.requireNonNull(verticalAlign, "Vertical alignment cannot be null");
    }
}
