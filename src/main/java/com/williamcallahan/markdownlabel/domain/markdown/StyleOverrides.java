package com.williamcallahan.markdownlabel.domain.markdown;

import com.williamcallahan.markdownlabel.domain.render.HorizontalAlign;
import com.williamcallahan.markdownlabel.domain.render.LinkStyle;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.Rgba;
import com.williamcallahan.markdownlabel.domain.render.VerticalAlign;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-request style changes; every null field keeps the configured default.
 */
public record StyleOverrides(
    Double baseFontSize,
    String codeFontName,
    String bodyFontName,
    Double lineHeight,
    String horizontalAlign,
    String verticalAlign,
    Double textWidthConstraint,
    String linkStyle,
    String baseDirection,
    Boolean disabled,
    List<Double> linkColor,
    List<Double> codeBackgroundColor,
    List<Double> bodyColor,
    List<Double> disabledColor
) {

    /**
     * Creates overrides that change nothing.
     * @return empty overrides
     */
    public static StyleOverrides none() {
        return new StyleOverrides(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Applies these overrides on top of a base style.
     *
     * @param base configured style
     * @return new style with overridden values
     * @throws IllegalArgumentException when a value is out of range or an enum name is unknown
     */
    public RenderStyle applyTo(RenderStyle base) {
        RenderStyle.Builder builder = base.toBuilder();
        if (baseFontSize != null) {
            builder.baseFontSize(baseFontSize);
        }
        if (codeFontName != null) {
            builder.codeFontName(codeFontName);
        }
        if (bodyFontName != null) {
            builder.bodyFontName(bodyFontName);
        }
        if (lineHeight != null) {
            builder.lineHeight(lineHeight);
        }
        if (horizontalAlign != null) {
            builder.horizontalAlign(named("horizontalAlign", horizontalAlign, HorizontalAlign::fromName));
        }
        if (verticalAlign != null) {
            builder.verticalAlign(named("verticalAlign", verticalAlign, VerticalAlign::fromName));
        }
        if (textWidthConstraint != null) {
            builder.textWidthConstraint(textWidthConstraint);
        }
        if (linkStyle != null) {
            builder.linkStyle(named("linkStyle", linkStyle, LinkStyle::fromName));
        }
        if (baseDirection != null) {
            builder.baseDirection(baseDirection);
        }
        if (disabled != null) {
            builder.disabled(disabled);
        }
        if (linkColor != null) {
            builder.linkColor(Rgba.fromComponents(linkColor));
        }
        if (codeBackgroundColor != null) {
            builder.codeBackgroundColor(Rgba.fromComponents(codeBackgroundColor));
        }
        if (bodyColor != null) {
            builder.bodyColor(Rgba.fromComponents(bodyColor));
        }
        if (disabledColor != null) {
            builder.disabledColor(Rgba.fromComponents(disabledColor));
        }
        return builder.build();
    }

    private static <T> T named(String field, String name, Function<String, Optional<T>> parser) {
        return parser.apply(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown " + field + " value: " + name));
    }
}
