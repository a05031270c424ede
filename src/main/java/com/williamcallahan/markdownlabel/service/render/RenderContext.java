package com.williamcallahan.markdownlabel.service.render;

import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import com.williamcallahan.markdownlabel.domain.render.HorizontalAlign;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.Rgba;
import com.williamcallahan.markdownlabel.domain.render.TextStyle;
import com.williamcallahan.markdownlabel.domain.render.VerticalAlign;

import java.util.Objects;

/**
 * Mutable state of one render call: the style, the depth guard, the list counters and the
 * inline renderer. Never shared between calls.
 */
final class RenderContext {

    static final Rgba CODE_TEXT_COLOR = new Rgba(0.9, 0.9, 0.9, 1);
    static final Rgba PLACEHOLDER_COLOR = new Rgba(0.6, 0.6, 0.6, 1);
    static final double MARKER_WIDTH = 30;

    private final RenderStyle style;
    private final NestingDepthGuard depthGuard;
    private final ListState listState;
    private final ReferenceResolver referenceResolver;
    private final InlineMarkupRenderer inlineRenderer;

    RenderContext(RenderStyle style, ReferenceTable references) {
        this.style = Objects.requireNonNull(style, "Render style cannot be null");
        this.depthGuard = new NestingDepthGuard();
        this.listState = new ListState();
        this.referenceResolver = new ReferenceResolver(references);
        this.inlineRenderer = new InlineMarkupRenderer(style, referenceResolver);
    }

    RenderStyle style() {
        return style;
    }

    NestingDepthGuard depthGuard() {
        return depthGuard;
    }

    ListState listState() {
        return listState;
    }

    ReferenceResolver referenceResolver() {
        return referenceResolver;
    }

    InlineMarkupRenderer inlineRenderer() {
        return inlineRenderer;
    }

    HorizontalAlign alignment() {
        return style.effectiveHorizontalAlign();
    }

    boolean isRightAligned() {
        return alignment() == HorizontalAlign.RIGHT;
    }

    TextStyle bodyStyle() {
        return bodyStyle(alignment(), false);
    }

    TextStyle bodyStyle(HorizontalAlign alignment, boolean bold) {
        return new TextStyle(style.bodyFontName(), style.baseFontSize(), 1.0, style.effectiveColor(), bold, false,
            alignment, style.verticalAlign(), style.lineHeight(), true, style.textWidthConstraint(), null);
    }

    TextStyle headingStyle(int level) {
        double scale = RenderStyle.headingScale(level);
        return new TextStyle(style.bodyFontName(), style.baseFontSize() * scale, scale, style.effectiveColor(), true,
            false, alignment(), style.verticalAlign(), style.lineHeight(), true, style.textWidthConstraint(), null);
    }

    TextStyle codeStyle() {
        Rgba color = style.disabled() ? style.disabledColor() : CODE_TEXT_COLOR;
        return new TextStyle(style.codeFontName(), style.baseFontSize(), 1.0, color, false, false,
            HorizontalAlign.LEFT, VerticalAlign.TOP, style.lineHeight(), true, style.textWidthConstraint(), null);
    }

    TextStyle markerStyle() {
        return new TextStyle(style.bodyFontName(), style.baseFontSize(), 1.0, style.effectiveColor(), false, false,
            HorizontalAlign.RIGHT, VerticalAlign.TOP, style.lineHeight(), false, null, MARKER_WIDTH);
    }

    TextStyle placeholderStyle() {
        return new TextStyle(style.bodyFontName(), style.baseFontSize(), 1.0, PLACEHOLDER_COLOR, false, true,
            alignment(), style.verticalAlign(), style.lineHeight(), false, style.textWidthConstraint(), null);
    }
}
