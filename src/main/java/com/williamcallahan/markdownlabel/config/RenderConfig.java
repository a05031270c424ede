package com.williamcallahan.markdownlabel.config;

import com.williamcallahan.markdownlabel.domain.render.HorizontalAlign;
import com.williamcallahan.markdownlabel.domain.render.LinkStyle;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.VerticalAlign;

import java.util.Locale;

/**
 * Default styling applied to every render unless a request overrides it.
 */
public class RenderConfig {

    private static final double BASE_FONT_SIZE_DEF = 15.0d;
    private static final String CODE_FONT_DEF = "RobotoMono-Regular";
    private static final String BODY_FONT_DEF = "Roboto";
    private static final double LINE_HEIGHT_DEF = 1.0d;
    private static final String HALIGN_DEF = "auto";
    private static final String VALIGN_DEF = "bottom";
    private static final String LINK_STYLE_DEF = "unstyled";
    private static final String BASE_FONT_SIZE_KEY = "markdown.render.base-font-size";
    private static final String CODE_FONT_KEY = "markdown.render.code-font-name";
    private static final String BODY_FONT_KEY = "markdown.render.body-font-name";
    private static final String LINE_HEIGHT_KEY = "markdown.render.line-height";
    private static final String HALIGN_KEY = "markdown.render.horizontal-align";
    private static final String VALIGN_KEY = "markdown.render.vertical-align";
    private static final String LINK_STYLE_KEY = "markdown.render.link-style";
    private static final String WIDTH_KEY = "markdown.render.text-width-constraint";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String UNKNOWN_NAME_FMT = "%s has unknown value '%s'.";

    private double baseFontSize = BASE_FONT_SIZE_DEF;
    private String codeFontName = CODE_FONT_DEF;
    private String bodyFontName = BODY_FONT_DEF;
    private double lineHeight = LINE_HEIGHT_DEF;
    private String horizontalAlign = HALIGN_DEF;
    private String verticalAlign = VALIGN_DEF;
    private Double textWidthConstraint;
    private String linkStyle = LINK_STYLE_DEF;
    private String baseDirection;
    private boolean disabled;
    private RenderColorsConfig colors = new RenderColorsConfig();

    public RenderConfig() {}

    /**
     * Validates render settings.
     */
    public void validateConfiguration() {
        requirePositive(BASE_FONT_SIZE_KEY, baseFontSize);
        requirePositive(LINE_HEIGHT_KEY, lineHeight);
        requireNonNullText(CODE_FONT_KEY, codeFontName);
        requireNonNullText(BODY_FONT_KEY, bodyFontName);
        if (textWidthConstraint != null) {
            requirePositive(WIDTH_KEY, textWidthConstraint);
        }
        resolveHorizontalAlign();
        resolveVerticalAlign();
        resolveLinkStyle();
        colors.validateConfiguration();
    }

    /**
     * Builds the immutable style these settings describe.
     *
     * @return render style
     */
    public RenderStyle toRenderStyle() {
        return RenderStyle.builder()
            .baseFontSize(baseFontSize)
            .codeFontName(codeFontName)
            .bodyFontName(bodyFontName)
            .lineHeight(lineHeight)
            .horizontalAlign(resolveHorizontalAlign())
            .verticalAlign(resolveVerticalAlign())
            .textWidthConstraint(textWidthConstraint)
            .linkStyle(resolveLinkStyle())
            .baseDirection(baseDirection)
            .disabled(disabled)
            .linkColor(colors.linkColor())
            .codeBackgroundColor(colors.codeBackgroundColor())
            .bodyColor(colors.bodyColor())
            .disabledColor(colors.disabledColor())
            .build();
    }

    private HorizontalAlign resolveHorizontalAlign() {
        return HorizontalAlign.fromName(horizontalAlign).orElseThrow(() -> new IllegalArgumentException(
            String.format(Locale.ROOT, UNKNOWN_NAME_FMT, HALIGN_KEY, horizontalAlign)));
    }

    private VerticalAlign resolveVerticalAlign() {
        return VerticalAlign.fromName(verticalAlign).orElseThrow(() -> new IllegalArgumentException(
            String.format(Locale.ROOT, UNKNOWN_NAME_FMT, VALIGN_KEY, verticalAlign)));
    }

    private LinkStyle resolveLinkStyle() {
        return LinkStyle.fromName(linkStyle).orElseThrow(() -> new IllegalArgumentException(
            String.format(Locale.ROOT, UNKNOWN_NAME_FMT, LINK_STYLE_KEY, linkStyle)));
    }

    public double getBaseFontSize() {
        return baseFontSize;
    }

    public void setBaseFontSize(final double baseFontSize) {
        this.baseFontSize = baseFontSize;
    }

    public String getCodeFontName() {
        return codeFontName;
    }

    public void setCodeFontName(final String codeFontName) {
        this.codeFontName = requireNonNullText(CODE_FONT_KEY, codeFontName);
    }

    public String getBodyFontName() {
        return bodyFontName;
    }

    public void setBodyFontName(final String bodyFontName) {
        this.bodyFontName = requireNonNullText(BODY_FONT_KEY, bodyFontName);
    }

    public double getLineHeight() {
        return lineHeight;
    }

    public void setLineHeight(final double lineHeight) {
        this.lineHeight = lineHeight;
    }

    public String getHorizontalAlign() {
        return horizontalAlign;
    }

    public void setHorizontalAlign(final String horizontalAlign) {
        this.horizontalAlign = horizontalAlign;
    }

    public String getVerticalAlign() {
        return verticalAlign;
    }

    public void setVerticalAlign(final String verticalAlign) {
        this.verticalAlign = verticalAlign;
    }

    public Double getTextWidthConstraint() {
        return textWidthConstraint;
    }

    public void setTextWidthConstraint(final Double textWidthConstraint) {
        this.textWidthConstraint = textWidthConstraint;
    }

    public String getLinkStyle() {
        return linkStyle;
    }

    public void setLinkStyle(final String linkStyle) {
        this.linkStyle = linkStyle;
    }

    public String getBaseDirection() {
        return baseDirection;
    }

    public void setBaseDirection(final String baseDirection) {
        this.baseDirection = baseDirection;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public void setDisabled(final boolean disabled) {
        this.disabled = disabled;
    }

    public RenderColorsConfig getColors() {
        return colors;
    }

    public void setColors(final RenderColorsConfig colors) {
        this.colors = colors == null ? new RenderColorsConfig() : colors;
    }

    private static void requirePositive(final String propertyKey, final double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }

    private static String requireNonNullText(final String propertyKey, final String text) {
        if (text == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, propertyKey));
        }
        return text;
    }
}
