package com.williamcallahan.markdownlabel.domain.markdown;

import com.williamcallahan.markdownlabel.domain.render.HorizontalAlign;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.Rgba;
import com.williamcallahan.markdownlabel.domain.render.VerticalAlign;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StyleOverridesTest {

    @Test
    void noOverridesKeepTheBaseStyle() {
        RenderStyle base = RenderStyle.defaults();
        assertEquals(base, StyleOverrides.none().applyTo(base));
    }

    @Test
    void overridesReplaceOnlyGivenFields() {
        StyleOverrides overrides = new StyleOverrides(20.0, null, null, null, "right", "middle", null, null,
            null, true, null, null, List.of(0.0, 0.0, 0.0, 1.0), null);

        RenderStyle style = overrides.applyTo(RenderStyle.defaults());

        assertEquals(20, style.baseFontSize());
        assertEquals(HorizontalAlign.RIGHT, style.horizontalAlign());
        assertEquals(VerticalAlign.MIDDLE, style.verticalAlign());
        assertTrue(style.disabled());
        assertEquals(new Rgba(0, 0, 0, 1), style.bodyColor());
        assertEquals(RenderStyle.defaults().codeFontName(), style.codeFontName());
    }

    @Test
    void unknownEnumNamesAreRejected() {
        StyleOverrides overrides = new StyleOverrides(null, null, null, null, null, null, null, "blinking",
            null, null, null, null, null, null);

        IllegalArgumentException failure = assertThrows(IllegalArgumentException.class,
            () -> overrides.applyTo(RenderStyle.defaults()));
        assertEquals("Unknown linkStyle value: blinking", failure.getMessage());
    }

    @Test
    void invalidWidthAndColorOverridesAreRejected() {
        StyleOverrides zeroWidth = new StyleOverrides(null, null, null, null, null, null, 0.0, null,
            null, null, null, null, null, null);
        StyleOverrides nullComponent = new StyleOverrides(null, null, null, null, null, null, null, null,
            null, null, Arrays.asList(1.0, null, 0.0, 1.0), null, null, null);

        assertThrows(IllegalArgumentException.class, () -> zeroWidth.applyTo(RenderStyle.defaults()));
        assertThrows(IllegalArgumentException.class, () -> nullComponent.applyTo(RenderStyle.defaults()));
    }

    @Test
    void renderRequestDefaultsMissingFields() {
        MarkdownRenderRequest request = MarkdownRenderRequest.create(null, null);

        assertEquals("", request.content());
        assertEquals(StyleOverrides.none(), request.style());
        assertTrue(request.isBlank());
    }
}
