package com.williamcallahan.markdownlabel.domain.render;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable styling knobs for one render pass.
 *
 * <p>Values are threaded through rendering unchanged; the only computed values are the
 * heading sizes, which scale {@code baseFontSize} by {@link #HEADING_SIZES}, and the
 * effective alignment and color helpers.</p>
 *
 * @param baseFontSize body font size every other size derives from
 * @param codeFontName monospace font for code spans and code blocks
 * @param linkColor color of styled links
 * @param codeBackgroundColor fill behind code blocks
 * @param bodyFontName font for body text
 * @param bodyColor color of body text
 * @param lineHeight line height multiplier
 * @param horizontalAlign requested horizontal alignment
 * @param verticalAlign vertical alignment of body text
 * @param textWidthConstraint wrapping width, null for unconstrained
 * @param linkStyle link decoration mode
 * @param baseDirection base text direction such as {@code "rtl"}, null when unspecified
 * @param disabled whether text is drawn in the disabled color
 * @param disabledColor text color used when disabled
 */
public record RenderStyle(
    double baseFontSize,
    String codeFontName,
    Rgba linkColor,
    Rgba codeBackgroundColor,
    String bodyFontName,
    Rgba bodyColor,
    double lineHeight,
    HorizontalAlign horizontalAlign,
    VerticalAlign verticalAlign,
    Double textWidthConstraint,
    LinkStyle linkStyle,
    String baseDirection,
    boolean disabled,
    Rgba disabledColor
) {

    /** Heading font size multipliers relative to {@code baseFontSize}, keyed by level. */
    public static final Map<Integer, Double> HEADING_SIZES = Map.of(
        1, 2.5,
        2, 2.0,
        3, 1.75,
        4, 1.5,
        5, 1.25,
        6, 1.0
    );

    public static final Rgba DEFAULT_LINK_COLOR = new Rgba(0, 0.5, 1, 1);
    public static final Rgba DEFAULT_CODE_BACKGROUND = new Rgba(0.15, 0.15, 0.15, 1);
    public static final Rgba DEFAULT_BODY_COLOR = new Rgba(1, 1, 1, 1);
    public static final Rgba DEFAULT_DISABLED_COLOR = new Rgba(1, 1, 1, 0.3);

    public RenderStyle {
        if (!(baseFontSize > 0)) {
            throw new IllegalArgumentException("Base font size must be positive: " + baseFontSize);
        }
        if (!(lineHeight > 0)) {
            throw new IllegalArgumentException("Line height must be positive: " + lineHeight);
        }
        if (textWidthConstraint != null && !(textWidthConstraint > 0)) {
            throw new IllegalArgumentException("Text width constraint must be positive: " + textWidthConstraint);
        }
        Objects.requireNonNull(codeFontName, "Code font name cannot be null");
        Objects.requireNonNull(bodyFontName, "Body font name cannot be null");
        Objects.requireNonNull(linkColor, "Link color cannot be null");
        Objects.requireNonNull(codeBackgroundColor, "Code background color cannot be null");
        Objects.requireNonNull(bodyColor, "Body color cannot be null");
        Objects.requireNonNull(disabledColor, "Disabled color cannot be null");
        horizontalAlign = Objects.requireNonNullElse(horizontalAlign, HorizontalAlign.AUTO);
        verticalAlign = Objects.requireNonNullElse(verticalAlign, VerticalAlign.BOTTOM);
        linkStyle = Objects.requireNonNullElse(linkStyle, LinkStyle.UNSTYLED);
    }

    /**
     * Gets the reference styling.
     * @return default style
     */
    public static RenderStyle defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-populated with this style's values.
     * @return builder copy
     */
    public Builder toBuilder() {
        return new Builder()
            .baseFontSize(baseFontSize)
            .codeFontName(codeFontName)
            .linkColor(linkColor)
            .codeBackgroundColor(codeBackgroundColor)
            .bodyFontName(bodyFontName)
            .bodyColor(bodyColor)
            .lineHeight(lineHeight)
            .horizontalAlign(horizontalAlign)
            .verticalAlign(verticalAlign)
            .textWidthConstraint(textWidthConstraint)
            .linkStyle(linkStyle)
            .baseDirection(baseDirection)
            .disabled(disabled)
            .disabledColor(disabledColor);
    }

    /**
     * Computes the font size of a heading; levels outside 1..6 are clamped.
     * @param level heading level
     * @return {@code baseFontSize * HEADING_SIZES[level]}
     */
    public double headingFontSize(int level) {
        return baseFontSize * headingScale(level);
    }

    /**
     * Gets the heading multiplier; levels outside 1..6 are clamped.
     * @param level heading level
     * @return multiplier from {@link #HEADING_SIZES}
     */
    public static double headingScale(int level) {
        return HEADING_SIZES.get(clampHeadingLevel(level));
    }

    /**
     * Clamps a heading level into 1..6.
     * @param level requested level
     * @return level within range
     */
    public static int clampHeadingLevel(int level) {
        return Math.max(1, Math.min(6, level));
    }

    /**
     * Resolves {@link HorizontalAlign#AUTO} against the base direction.
     * @return {@code RIGHT} for right-to-left text, {@code LEFT} otherwise, or the explicit alignment
     */
    public HorizontalAlign effectiveHorizontalAlign() {
        if (horizontalAlign != HorizontalAlign.AUTO) {
            return horizontalAlign;
        }
        if (baseDirection != null) {
            String direction = baseDirection.toLowerCase(Locale.ROOT);
            if (direction.equals("rtl") || direction.equals("weak_rtl")) {
                return HorizontalAlign.RIGHT;
            }
        }
        return HorizontalAlign.LEFT;
    }

    /**
     * Gets the body text color after applying the disabled state.
     * @return disabled color when disabled, body color otherwise
     */
    public Rgba effectiveColor() {
        return disabled ? disabledColor : bodyColor;
    }

    /**
     * Mutable builder; every field starts at the reference default.
     */
    public static final class Builder {
        private double baseFontSize = 15;
        private String codeFontName = "RobotoMono-Regular";
        private Rgba linkColor = DEFAULT_LINK_COLOR;
        private Rgba codeBackgroundColor = DEFAULT_CODE_BACKGROUND;
        private String bodyFontName = "Roboto";
        private Rgba bodyColor = DEFAULT_BODY_COLOR;
        private double lineHeight = 1.0;
        private HorizontalAlign horizontalAlign = HorizontalAlign.AUTO;
        private VerticalAlign verticalAlign = VerticalAlign.BOTTOM;
        private Double textWidthConstraint;
        private LinkStyle linkStyle = LinkStyle.UNSTYLED;
        private String baseDirection;
        private boolean disabled;
        private Rgba disabledColor = DEFAULT_DISABLED_COLOR;

        private Builder() {}

        public Builder baseFontSize(double baseFontSize) {
            this.baseFontSize = baseFontSize;
            return this;
        }

        public Builder codeFontName(String codeFontName) {
            this.codeFontName = codeFontName;
            return this;
        }

        public Builder linkColor(Rgba linkColor) {
            this.linkColor = linkColor;
            return this;
        }

        public Builder codeBackgroundColor(Rgba codeBackgroundColor) {
            this.codeBackgroundColor = codeBackgroundColor;
            return this;
        }

        public Builder bodyFontName(String bodyFontName) {
            this.bodyFontName = bodyFontName;
            return this;
        }

        public Builder bodyColor(Rgba bodyColor) {
            this.bodyColor = bodyColor;
            return this;
        }

        public Builder lineHeight(double lineHeight) {
            this.lineHeight = lineHeight;
            return this;
        }

        public Builder horizontalAlign(HorizontalAlign horizontalAlign) {
            this.horizontalAlign = horizontalAlign;
            return this;
        }

        public Builder verticalAlign(VerticalAlign verticalAlign) {
            this.verticalAlign = verticalAlign;
            return this;
        }

        public Builder textWidthConstraint(Double textWidthConstraint) {
            this.textWidthConstraint = textWidthConstraint;
            return this;
        }

        public Builder linkStyle(LinkStyle linkStyle) {
            this.linkStyle = linkStyle;
            return this;
        }

        public Builder baseDirection(String baseDirection) {
            this.baseDirection = baseDirection;
            return this;
        }

        public Builder disabled(boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        public Builder disabledColor(Rgba disabledColor) {
            this.disabledColor = disabledColor;
            return this;
        }

        public RenderStyle build() {
            return new RenderStyle(baseFontSize, codeFontName, linkColor, codeBackgroundColor, bodyFontName,
                bodyColor, lineHeight, horizontalAlign, verticalAlign, textWidthConstraint, linkStyle,
                baseDirection, disabled, disabledColor);
        }
    }
}
