package com.williamcallahan.markdownlabel.service.markdown;

import com.williamcallahan.markdownlabel.config.MarkdownLabelProperties;
import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.ParsedDocument;
import com.williamcallahan.markdownlabel.domain.ast.TokenText;
import com.williamcallahan.markdownlabel.domain.markdown.MarkdownCacheStatsSnapshot;
import com.williamcallahan.markdownlabel.domain.render.LinkStyle;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.TextRole;
import com.williamcallahan.markdownlabel.domain.render.VisualNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownLabelServiceTest {

    private static final String SAMPLE = "# Title\n\nSee [docs](https://docs.test).";

    private MarkdownLabelProperties properties;
    private MarkdownLabelService service;

    @BeforeEach
    void setUp() {
        properties = new MarkdownLabelProperties();
        service = new MarkdownLabelService(properties);
    }

    @Test
    @DisplayName("Repeated parses are served from the cache")
    void cachesParsedDocuments() {
        ParsedDocument first = service.parse(SAMPLE);
        ParsedDocument second = service.parse(SAMPLE);

        assertSame(first, second);
        MarkdownCacheStatsSnapshot stats = service.getCacheStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals("50.00%", stats.hitRate());
    }

    @Test
    void clearCacheDropsEntries() {
        service.parse(SAMPLE);
        service.clearCache();

        assertEquals(0, service.getCacheStats().size());
    }

    @Test
    void emptyInputIsEmptyDocument() {
        assertEquals(ParsedDocument.empty(), service.parse(""));
        assertEquals(ParsedDocument.empty(), service.parse(null));
        assertTrue(service.render("", RenderStyle.defaults()).children().isEmpty());
    }

    @Test
    void oversizedInputIsTruncated() {
        properties.getParse().setMaxInputLength(5);
        MarkdownLabelService limited = new MarkdownLabelService(properties);

        ParsedDocument document = limited.parse("abcdefghij");

        assertEquals("abcde", TokenText.plainText(document.tokens().get(0).children()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-", "*", "+", "  - "})
    @DisplayName("A lone list marker is plain text, not an empty list")
    void loneBulletIsText(String markdown) {
        ParsedDocument document = service.parse(markdown);

        assertEquals(List.of(new MarkdownToken.Paragraph(List.of(new MarkdownToken.Text(markdown.strip())))),
            document.tokens());
    }

    @Test
    void rendersWithRequestedStyle() {
        RenderStyle styled = RenderStyle.builder().linkStyle(LinkStyle.STYLED).build();

        VisualNode.Container document = service.render(SAMPLE, styled);

        VisualNode.Text paragraph = (VisualNode.Text) document.children().get(1);
        assertTrue(paragraph.markup().contains("[u][ref=https://docs.test]docs[/ref][/u]"));
    }

    @Test
    void nullStyleFallsBackToConfiguredDefault() {
        properties.getRender().setBaseFontSize(20);
        MarkdownLabelService configured = new MarkdownLabelService(properties);
        ParsedDocument document = configured.parse("text");

        VisualNode.Container tree = configured.renderTokens(document.tokens(), document.references(), null);

        assertEquals(20, ((VisualNode.Text) tree.children().get(0)).style().fontSize());
        assertEquals(20, configured.defaultStyle().baseFontSize());
    }

    @Test
    void toMarkdownWritesDocumentBack() {
        assertEquals("# Title\n\nSee [docs](https://docs.test).", service.toMarkdown(service.parse(SAMPLE)));
        assertEquals("", service.toMarkdown(null));
    }

    @Test
    @DisplayName("Deeply nested source renders one placeholder instead of failing")
    void deeplyNestedSourceRendersPlaceholder() {
        VisualNode.Container tree = assertDoesNotThrow(
            () -> service.render(">".repeat(2000) + " x", RenderStyle.defaults()));

        List<VisualNode.Text> placeholders = new ArrayList<>();
        collectPlaceholders(tree, placeholders);
        assertEquals(1, placeholders.size());
    }

    private static void collectPlaceholders(VisualNode node, List<VisualNode.Text> placeholders) {
        if (node instanceof VisualNode.Text text && text.role() == TextRole.PLACEHOLDER) {
            placeholders.add(text);
        } else if (node instanceof VisualNode.Container container) {
            container.children().forEach(child -> collectPlaceholders(child, placeholders));
        } else if (node instanceof VisualNode.Grid grid) {
            grid.cells().forEach(child -> collectPlaceholders(child, placeholders));
        }
    }
}
