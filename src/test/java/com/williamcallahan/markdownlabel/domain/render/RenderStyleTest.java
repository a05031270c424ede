package com.williamcallahan.markdownlabel.domain.render;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RenderStyleTest {

    @Test
    void headingSizesScaleBaseFontAndClampLevels() {
        RenderStyle style = RenderStyle.builder().baseFontSize(10).build();

        assertEquals(25, style.headingFontSize(1));
        assertEquals(10, style.headingFontSize(6));
        assertEquals(style.headingFontSize(1), style.headingFontSize(0));
        assertEquals(style.headingFontSize(6), style.headingFontSize(9));
    }

    @Test
    void autoAlignmentFollowsBaseDirection() {
        assertEquals(HorizontalAlign.LEFT, RenderStyle.defaults().effectiveHorizontalAlign());
        assertEquals(HorizontalAlign.RIGHT,
            RenderStyle.builder().baseDirection("RTL").build().effectiveHorizontalAlign());
        assertEquals(HorizontalAlign.RIGHT,
            RenderStyle.builder().baseDirection("weak_rtl").build().effectiveHorizontalAlign());
        assertEquals(HorizontalAlign.CENTER, RenderStyle.builder()
            .baseDirection("rtl").horizontalAlign(HorizontalAlign.CENTER).build().effectiveHorizontalAlign());
    }

    @Test
    void toBuilderCopiesEveryField() {
        RenderStyle style = RenderStyle.builder()
            .baseFontSize(12).linkStyle(LinkStyle.STYLED).disabled(true).textWidthConstraint(300.0).build();

        assertEquals(style, style.toBuilder().build());
    }

    @Test
    void rejectsNonPositiveSizes() {
        assertThrows(IllegalArgumentException.class, () -> RenderStyle.builder().baseFontSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> RenderStyle.builder().lineHeight(-1).build());
        assertThrows(IllegalArgumentException.class, () -> RenderStyle.builder().textWidthConstraint(0.0).build());
        assertThrows(IllegalArgumentException.class, () -> RenderStyle.builder().textWidthConstraint(Double.NaN).build());
        assertNull(RenderStyle.builder().textWidthConstraint(null).build().textWidthConstraint());
    }

    @Test
    void colorsFormatAsHexAndValidateRange() {
        assertEquals("007fffff", RenderStyle.DEFAULT_LINK_COLOR.toHex());
        assertEquals(List.of(1.0, 1.0, 1.0, 0.3), RenderStyle.DEFAULT_DISABLED_COLOR.components());
        assertThrows(IllegalArgumentException.class, () -> new Rgba(1.5, 0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> Rgba.fromComponents(List.of(1.0)));
        assertThrows(IllegalArgumentException.class, () -> Rgba.fromComponents(Arrays.asList(1.0, null, 0.0, 1.0)));
    }
}
