package com.williamcallahan.markdownlabel.service.render;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.TokenText;
import com.williamcallahan.markdownlabel.domain.ast.TokenVisitor;
import com.williamcallahan.markdownlabel.domain.render.ContainerRole;
import com.williamcallahan.markdownlabel.domain.render.Orientation;
import com.williamcallahan.markdownlabel.domain.render.Padding;
import com.williamcallahan.markdownlabel.domain.render.Rgba;
import com.williamcallahan.markdownlabel.domain.render.TextRole;
import com.williamcallahan.markdownlabel.domain.render.VisualNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Block-level dispatcher: one visual node (or none) per block token.
 *
 * <p>Inline tokens reaching block level, unknown tags and table parts outside a table
 * produce no node. Lists and tables are delegated to {@link ListRenderer} and
 * {@link TableGridBuilder}.</p>
 */
final class BlockRenderer implements TokenVisitor<Optional<VisualNode>> {

    private static final Logger logger = LoggerFactory.getLogger(BlockRenderer.class);

    static final String TRUNCATION_TEXT = NestingDepthGuard.TRUNCATION_TEXT;
    static final Rgba RULE_COLOR = new Rgba(0.5, 0.5, 0.5, 1);
    static final double RULE_HEIGHT = 20;
    static final double CODE_PADDING = 10;
    static final Padding QUOTE_PADDING = new Padding(20, 5, 5, 5);
    static final double NEWLINE_SPACER = 5;

    private final RenderContext context;
    private final ListRenderer listRenderer;
    private final TableGridBuilder tableGridBuilder;

    BlockRenderer(RenderContext context) {
        this.context = context;
        this.listRenderer = new ListRenderer(context, this);
        this.tableGridBuilder = new TableGridBuilder(context);
    }

    List<VisualNode> renderBlocks(List<MarkdownToken> tokens) {
        List<VisualNode> nodes = new ArrayList<>(tokens.size());
        for (MarkdownToken token : tokens) {
            token.accept(this).ifPresent(nodes::add);
        }
        return nodes;
    }

    VisualNode truncationPlaceholder() {
        return new VisualNode.Text(TRUNCATION_TEXT, context.placeholderStyle(), TextRole.PLACEHOLDER);
    }

    @Override
    public Optional<VisualNode> visitParagraph(MarkdownToken.Paragraph paragraph) {
        return Optional.of(standaloneImage(paragraph.children()).orElseGet(() -> bodyText(paragraph.children())));
    }

    @Override
    public Optional<VisualNode> visitBlockText(MarkdownToken.BlockText blockText) {
        return Optional.of(standaloneImage(blockText.children()).orElseGet(() -> bodyText(blockText.children())));
    }

    @Override
    public Optional<VisualNode> visitHeading(MarkdownToken.Heading heading) {
        String markup = context.inlineRenderer().render(heading.children());
        return Optional.of(new VisualNode.Text(markup, context.headingStyle(heading.level()), TextRole.HEADING));
    }

    @Override
    public Optional<VisualNode> visitBlankLine(MarkdownToken.BlankLine blankLine) {
        return Optional.of(new VisualNode.Spacer(context.style().baseFontSize()));
    }

    @Override
    public Optional<VisualNode> visitList(MarkdownToken.ListBlock list) {
        return Optional.of(listRenderer.render(list));
    }

    @Override
    public Optional<VisualNode> visitListItem(MarkdownToken.ListItem listItem) {
        return Optional.of(new VisualNode.Container(ContainerRole.LIST_ITEM_CONTENT, Orientation.VERTICAL,
            Padding.NONE, null, renderBlocks(listItem.children()), Map.of()));
    }

    @Override
    public Optional<VisualNode> visitBlockCode(MarkdownToken.BlockCode blockCode) {
        String markup = MarkupEscaper.escape(stripTrailingNewlines(blockCode.raw()));
        VisualNode code = new VisualNode.Text(markup, context.codeStyle(), TextRole.CODE);
        return Optional.of(new VisualNode.Container(ContainerRole.CODE_BLOCK, Orientation.VERTICAL,
            Padding.uniform(CODE_PADDING), context.style().codeBackgroundColor(), List.of(code),
            Map.of("language", blockCode.info())));
    }

    @Override
    public Optional<VisualNode> visitBlockQuote(MarkdownToken.BlockQuote blockQuote) {
        NestingDepthGuard guard = context.depthGuard();
        guard.enter();
        try {
            if (guard.isExceeded()) {
                logger.warn("Nesting depth {} exceeds limit {}; truncating block quote",
                    guard.depth(), guard.maxDepth());
                return Optional.of(truncationPlaceholder());
            }
            return Optional.of(new VisualNode.Container(ContainerRole.BLOCK_QUOTE, Orientation.VERTICAL,
                QUOTE_PADDING, null, renderBlocks(blockQuote.children()), Map.of()));
        } finally {
            guard.exit();
        }
    }

    @Override
    public Optional<VisualNode> visitBlockHtml(MarkdownToken.BlockHtml blockHtml) {
        String markup = MarkupEscaper.escape(stripTrailingNewlines(blockHtml.raw()));
        return Optional.of(new VisualNode.Text(markup, context.bodyStyle(), TextRole.BODY));
    }

    @Override
    public Optional<VisualNode> visitThematicBreak(MarkdownToken.ThematicBreak thematicBreak) {
        return Optional.of(new VisualNode.Rule(RULE_HEIGHT, 1, RULE_COLOR));
    }

    @Override
    public Optional<VisualNode> visitTable(MarkdownToken.Table table) {
        return Optional.of(tableGridBuilder.build(table));
    }

    @Override
    public Optional<VisualNode> visitTableCell(MarkdownToken.TableCell tableCell) {
        return Optional.of(tableGridBuilder.cell(tableCell, tableCell.head()));
    }

    @Override
    public Optional<VisualNode> visitImage(MarkdownToken.Image image) {
        return Optional.of(imageNode(image));
    }

    @Override
    public Optional<VisualNode> visitTableHead(MarkdownToken.TableHead tableHead) {
        return skip(tableHead);
    }

    @Override
    public Optional<VisualNode> visitTableBody(MarkdownToken.TableBody tableBody) {
        return skip(tableBody);
    }

    @Override
    public Optional<VisualNode> visitTableRow(MarkdownToken.TableRow tableRow) {
        return skip(tableRow);
    }

    @Override
    public Optional<VisualNode> visitUnknown(MarkdownToken.Unknown unknown) {
        if ("newline".equals(unknown.tag())) {
            return Optional.of(new VisualNode.Spacer(NEWLINE_SPACER));
        }
        return skip(unknown);
    }

    @Override
    public Optional<VisualNode> visitText(MarkdownToken.Text text) {
        return skip(text);
    }

    @Override
    public Optional<VisualNode> visitStrong(MarkdownToken.Strong strong) {
        return skip(strong);
    }

    @Override
    public Optional<VisualNode> visitEmphasis(MarkdownToken.Emphasis emphasis) {
        return skip(emphasis);
    }

    @Override
    public Optional<VisualNode> visitStrikethrough(MarkdownToken.Strikethrough strikethrough) {
        return skip(strikethrough);
    }

    @Override
    public Optional<VisualNode> visitCodeSpan(MarkdownToken.CodeSpan codeSpan) {
        return skip(codeSpan);
    }

    @Override
    public Optional<VisualNode> visitLink(MarkdownToken.Link link) {
        return skip(link);
    }

    @Override
    public Optional<VisualNode> visitSoftBreak(MarkdownToken.SoftBreak softBreak) {
        return skip(softBreak);
    }

    @Override
    public Optional<VisualNode> visitLineBreak(MarkdownToken.LineBreak lineBreak) {
        return skip(lineBreak);
    }

    @Override
    public Optional<VisualNode> visitInlineHtml(MarkdownToken.InlineHtml inlineHtml) {
        return skip(inlineHtml);
    }

    private VisualNode bodyText(List<MarkdownToken> children) {
        return new VisualNode.Text(context.inlineRenderer().render(children), context.bodyStyle(), TextRole.BODY);
    }

    // A paragraph consisting of one image is shown as the image itself.
    private Optional<VisualNode> standaloneImage(List<MarkdownToken> children) {
        if (children.size() == 1 && children.get(0) instanceof MarkdownToken.Image image) {
            return Optional.of(imageNode(image));
        }
        return Optional.empty();
    }

    private VisualNode imageNode(MarkdownToken.Image image) {
        String source = context.referenceResolver().resolve(image).url();
        return new VisualNode.Image(source, TokenText.plainText(image.children()));
    }

    private Optional<VisualNode> skip(MarkdownToken token) {
        logger.debug("Skipping token '{}' at block level", token.tag());
        return Optional.empty();
    }

    private static String stripTrailingNewlines(String raw) {
        int end = raw.length();
        while (end > 0 && (raw.charAt(end - 1) == '\n' || raw.charAt(end - 1) == '\r')) {
            end--;
        }
        return raw.substring(0, end);
    }
}
