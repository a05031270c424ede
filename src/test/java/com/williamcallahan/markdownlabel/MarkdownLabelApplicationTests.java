package com.williamcallahan.markdownlabel;

import com.williamcallahan.markdownlabel.domain.render.LinkStyle;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.service.markdown.MarkdownLabelService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = {
        "markdown.render.link-style=styled",
        "markdown.render.colors.link=1,0,0,1"
})
class MarkdownLabelApplicationTests {

    @Autowired
    MarkdownLabelService markdownLabelService;

    @Test
    void contextLoadsWithBoundRenderDefaults() {
        RenderStyle style = markdownLabelService.defaultStyle();

        assertEquals(LinkStyle.STYLED, style.linkStyle());
        assertEquals("ff0000ff", style.linkColor().toHex());
        assertEquals(15, style.baseFontSize());
    }
}
