package com.williamcallahan.markdownlabel.service.markdown;

import com.vladsch.flexmark.util.sequence.BasedSequence;
import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.ParsedDocument;
import com.williamcallahan.markdownlabel.domain.ast.TokenText;
import com.williamcallahan.markdownlabel.service.render.NestingDepthGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlexmarkTokenConverterTest {

    private FlexmarkTokenConverter converter;

    @BeforeEach
    void setUp() {
        converter = new FlexmarkTokenConverter();
    }

    private List<MarkdownToken> parse(String markdown) {
        return converter.parse(markdown).tokens();
    }

    private static List<MarkdownToken> text(String raw) {
        return List.of(new MarkdownToken.Text(raw));
    }

    @Test
    @DisplayName("Empty and null input produce an empty document")
    void emptyInput() {
        assertEquals(ParsedDocument.empty(), converter.parse(""));
        assertEquals(ParsedDocument.empty(), converter.parse(null));
    }

    @Test
    @DisplayName("Should map headings and inline emphasis")
    void headingAndEmphasis() {
        List<MarkdownToken> tokens = parse("# Title\n\nHello *world* and **bold** ~~gone~~");

        assertEquals(new MarkdownToken.Heading(1, text("Title")), tokens.get(0));
        assertEquals(new MarkdownToken.Paragraph(List.of(
            new MarkdownToken.Text("Hello "),
            new MarkdownToken.Emphasis(text("world")),
            new MarkdownToken.Text(" and "),
            new MarkdownToken.Strong(text("bold")),
            new MarkdownToken.Text(" "),
            new MarkdownToken.Strikethrough(text("gone")))), tokens.get(1));
    }

    @Test
    @DisplayName("Tight list paragraphs become block_text")
    void nestedTightList() {
        List<MarkdownToken> tokens = parse("- a\n- b\n  - c");

        MarkdownToken nested = new MarkdownToken.ListBlock(false, 1, "-", true, List.of(
            new MarkdownToken.ListItem(List.of(new MarkdownToken.BlockText(text("c"))))));
        MarkdownToken expected = new MarkdownToken.ListBlock(false, 1, "-", true, List.of(
            new MarkdownToken.ListItem(List.of(new MarkdownToken.BlockText(text("a")))),
            new MarkdownToken.ListItem(List.of(new MarkdownToken.BlockText(text("b")), nested))));
        assertEquals(List.of(expected), tokens);
    }

    @Test
    void orderedListKeepsStartAndDelimiter() {
        MarkdownToken.ListBlock list = (MarkdownToken.ListBlock) parse("3. x\n4. y").get(0);

        assertTrue(list.ordered());
        assertEquals(3, list.start());
        assertEquals(".", list.bullet());
        assertEquals(2, list.children().size());
    }

    @Test
    void looseListKeepsParagraphs() {
        MarkdownToken.ListBlock list = (MarkdownToken.ListBlock) parse("- a\n\n- b").get(0);

        assertFalse(list.tight());
        assertInstanceOf(MarkdownToken.Paragraph.class, list.children().get(0).children().get(0));
    }

    @Test
    void fencedCodeKeepsInfoAndContent() {
        assertEquals(List.of(new MarkdownToken.BlockCode("int x;\n", "java")), parse("```java\nint x;\n```"));
    }

    @Test
    void codeSpanStripsOneSpaceOnEachSide() {
        MarkdownToken.Paragraph paragraph = (MarkdownToken.Paragraph) parse("`` a`b ``").get(0);
        assertEquals(List.of(new MarkdownToken.CodeSpan("a`b")), paragraph.children());
    }

    @Test
    void codeSpanNormalization() {
        assertEquals("a", FlexmarkTokenConverter.codeSpanContent(BasedSequence.of(" a ")));
        assertEquals("  ", FlexmarkTokenConverter.codeSpanContent(BasedSequence.of("  ")));
        assertEquals("a b", FlexmarkTokenConverter.codeSpanContent(BasedSequence.of("a\nb")));
        assertEquals(" a", FlexmarkTokenConverter.codeSpanContent(BasedSequence.of(" a")));
    }

    @Test
    void inlineLinkCarriesUrlAndTitle() {
        MarkdownToken.Paragraph paragraph = (MarkdownToken.Paragraph) parse("[site](https://x.test \"T\")").get(0);
        assertEquals(new MarkdownToken.Link(text("site"), "https://x.test", "T", null), paragraph.children().get(0));
    }

    @Test
    @DisplayName("Reference links keep their label and definitions are collected")
    void referenceLinks() {
        ParsedDocument document = converter.parse("[a][Docs] and ![logo][img]\n\n[docs]: https://docs.test \"Manual\"\n[img]: logo.png");

        assertEquals(1, document.tokens().size());
        MarkdownToken.Paragraph paragraph = (MarkdownToken.Paragraph) document.tokens().get(0);
        assertEquals(MarkdownToken.Link.reference(text("a"), "Docs"), paragraph.children().get(0));
        assertEquals(new MarkdownToken.Image(text("logo"), null, null, "img"), paragraph.children().get(2));
        assertEquals(2, document.references().size());
        assertEquals("https://docs.test", document.references().lookup("DOCS").orElseThrow().url());
        assertEquals("Manual", document.references().lookup("docs").orElseThrow().title());
    }

    @Test
    void undefinedReferenceStaysLiteral() {
        MarkdownToken.Paragraph paragraph = (MarkdownToken.Paragraph) parse("see [missing][nope]").get(0);

        assertEquals("see [missing][nope]", TokenText.plainText(paragraph.children()));
        assertTrue(paragraph.children().stream().noneMatch(MarkdownToken.Link.class::isInstance));
    }

    @Test
    void autolinkBecomesInlineLink() {
        MarkdownToken.Paragraph paragraph = (MarkdownToken.Paragraph) parse("<https://auto.test>").get(0);
        assertEquals(MarkdownToken.Link.inline(text("https://auto.test"), "https://auto.test"),
            paragraph.children().get(0));
    }

    @Test
    void tableSectionsRowsAndAlignment() {
        MarkdownToken.Table table = (MarkdownToken.Table) parse("| A | B |\n| :--- | ---: |\n| 1 | 2 |").get(0);

        MarkdownToken expected = new MarkdownToken.Table(List.of(
            new MarkdownToken.TableHead(List.of(new MarkdownToken.TableRow(List.of(
                new MarkdownToken.TableCell("left", true, text("A")),
                new MarkdownToken.TableCell("right", true, text("B")))))),
            new MarkdownToken.TableBody(List.of(new MarkdownToken.TableRow(List.of(
                new MarkdownToken.TableCell("left", false, text("1")),
                new MarkdownToken.TableCell("right", false, text("2"))))))));
        assertEquals(expected, table);
    }

    @Test
    void quotesBreaksAndRules() {
        List<MarkdownToken> tokens = parse("> quote\n\na  \nb\nc\n\n***");

        assertEquals(new MarkdownToken.BlockQuote(List.of(new MarkdownToken.Paragraph(text("quote")))), tokens.get(0));
        assertEquals(new MarkdownToken.Paragraph(List.of(
            new MarkdownToken.Text("a"),
            new MarkdownToken.LineBreak(),
            new MarkdownToken.Text("b"),
            new MarkdownToken.SoftBreak(),
            new MarkdownToken.Text("c"))), tokens.get(1));
        assertEquals(new MarkdownToken.ThematicBreak(), tokens.get(2));
    }

    @Test
    void escapesAndEntitiesAreDecodedAndMerged() {
        MarkdownToken.Paragraph paragraph = (MarkdownToken.Paragraph) parse("&amp; \\*not emphasis\\*").get(0);
        assertEquals(text("& *not emphasis*"), paragraph.children());
    }

    @Test
    void htmlBlocksAndInlineHtml() {
        List<MarkdownToken> tokens = parse("<div>x</div>\n\nsee <em>this</em>");

        MarkdownToken.BlockHtml block = assertInstanceOf(MarkdownToken.BlockHtml.class, tokens.get(0));
        assertEquals("<div>x</div>", block.raw().strip());
        MarkdownToken.Paragraph paragraph = (MarkdownToken.Paragraph) tokens.get(1);
        assertEquals(new MarkdownToken.InlineHtml("<em>"), paragraph.children().get(1));
    }

    @Test
    @DisplayName("Thousands of nested quotes convert to a bounded tree")
    void deeplyNestedQuotesAreTruncated() {
        List<MarkdownToken> tokens = assertDoesNotThrow(() -> parse(">".repeat(5000) + " x"));

        assertTrue(tokenDepth(tokens) <= FlexmarkTokenConverter.MAX_NODE_DEPTH + 2);
        assertTrue(containsTruncation(tokens));
    }

    @Test
    void deeplyNestedListsAreTruncated() {
        List<MarkdownToken> tokens = assertDoesNotThrow(() -> parse("- ".repeat(2000) + "x"));

        assertInstanceOf(MarkdownToken.ListBlock.class, tokens.get(0));
        assertTrue(tokenDepth(tokens) <= FlexmarkTokenConverter.MAX_NODE_DEPTH + 2);
        assertTrue(containsTruncation(tokens));
    }

    @Test
    void shallowNestingIsKeptWhole() {
        List<MarkdownToken> tokens = parse(">".repeat(12) + " inner");

        assertFalse(containsTruncation(tokens));
        assertEquals(14, tokenDepth(tokens));
    }

    @Test
    void referencesInsideContainersAreCollected() {
        ParsedDocument document = converter.parse("> [ref]: https://r.test\n\n[x][ref]");

        assertEquals("https://r.test", document.references().lookup("ref").orElseThrow().url());
        MarkdownToken.Paragraph paragraph = (MarkdownToken.Paragraph) document.tokens().get(1);
        assertEquals(MarkdownToken.Link.reference(text("x"), "ref"), paragraph.children().get(0));
    }

    @Test
    @DisplayName("Blocks following text in a tight list item stay siblings of block_text")
    void tightItemWithFollowingBlocks() {
        List<MarkdownToken> tokens = parse("- a\n  ***\n- b\n  > q");

        MarkdownToken.ListBlock list = (MarkdownToken.ListBlock) tokens.get(0);
        assertTrue(list.tight());
        assertEquals(new MarkdownToken.ListItem(List.of(
            new MarkdownToken.BlockText(text("a")),
            new MarkdownToken.ThematicBreak())), list.children().get(0));
        assertEquals(new MarkdownToken.ListItem(List.of(
            new MarkdownToken.BlockText(text("b")),
            new MarkdownToken.BlockQuote(List.of(new MarkdownToken.Paragraph(text("q")))))), list.children().get(1));
    }

    private static int tokenDepth(List<MarkdownToken> tokens) {
        int deepest = 0;
        for (MarkdownToken token : tokens) {
            deepest = Math.max(deepest, 1 + tokenDepth(token.children()));
        }
        return deepest;
    }

    private static boolean containsTruncation(List<MarkdownToken> tokens) {
        for (MarkdownToken token : tokens) {
            if (token instanceof MarkdownToken.Text textToken
                && textToken.raw().equals(NestingDepthGuard.TRUNCATION_TEXT)) {
                return true;
            }
            if (containsTruncation(token.children())) {
                return true;
            }
        }
        return false;
    }
}
