package com.williamcallahan.markdownlabel.service.serialize;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.TokenVisitor;
import com.williamcallahan.markdownlabel.service.render.ReferenceResolver;

import java.util.List;
import java.util.Optional;

/**
 * Writes inline tokens back as Markdown source.
 *
 * <p>Tracks whether output is at the start of a line so that text which would read as a
 * block marker there ({@code #}, {@code >}, {@code 1.}) gets escaped.</p>
 */
final class InlineMarkdownWriter implements TokenVisitor<String> {

    private final ReferenceResolver referenceResolver;
    private final ReferenceDeduplicator deduplicator;
    private boolean lineStart = true;

    InlineMarkdownWriter(ReferenceResolver referenceResolver, ReferenceDeduplicator deduplicator) {
        this.referenceResolver = referenceResolver;
        this.deduplicator = deduplicator;
    }

    /**
     * Writes inline content that begins a new line.
     * @param tokens inline tokens
     * @return Markdown source
     */
    String writeLine(List<MarkdownToken> tokens) {
        lineStart = true;
        return write(tokens);
    }

    private String write(List<MarkdownToken> tokens) {
        StringBuilder source = new StringBuilder();
        for (MarkdownToken token : tokens) {
            source.append(token.accept(this));
        }
        return source.toString();
    }

    private String wrap(String delimiter, List<MarkdownToken> children) {
        lineStart = false;
        return delimiter + write(children) + delimiter;
    }

    @Override
    public String visitText(MarkdownToken.Text text) {
        if (text.raw().isEmpty()) {
            return "";
        }
        String escaped = MarkdownTextEscaper.escapeText(text.raw(), lineStart);
        lineStart = false;
        return escaped;
    }

    @Override
    public String visitStrong(MarkdownToken.Strong strong) {
        return wrap("**", strong.children());
    }

    @Override
    public String visitEmphasis(MarkdownToken.Emphasis emphasis) {
        lineStart = false;
        String inner = write(emphasis.children());
        // "***" would be read as strong-inside-emphasis; underscores keep the nesting order
        String delimiter = inner.startsWith("*") || inner.endsWith("*") ? "_" : "*";
        return delimiter + inner + delimiter;
    }

    @Override
    public String visitStrikethrough(MarkdownToken.Strikethrough strikethrough) {
        return wrap("~~", strikethrough.children());
    }

    @Override
    public String visitCodeSpan(MarkdownToken.CodeSpan codeSpan) {
        lineStart = false;
        return CodeFenceResolver.codeSpan(codeSpan.raw());
    }

    @Override
    public String visitLink(MarkdownToken.Link link) {
        ReferenceResolver.ResolvedTarget target = referenceResolver.resolve(link);
        lineStart = false;
        return "[" + write(link.children()) + "]" + target(target);
    }

    @Override
    public String visitImage(MarkdownToken.Image image) {
        ReferenceResolver.ResolvedTarget target = referenceResolver.resolve(image);
        lineStart = false;
        return "![" + write(image.children()) + "]" + target(target);
    }

    @Override
    public String visitSoftBreak(MarkdownToken.SoftBreak softBreak) {
        lineStart = false;
        return " ";
    }

    @Override
    public String visitLineBreak(MarkdownToken.LineBreak lineBreak) {
        lineStart = true;
        return "\\\n";
    }

    @Override
    public String visitInlineHtml(MarkdownToken.InlineHtml inlineHtml) {
        lineStart = false;
        return inlineHtml.raw();
    }

    @Override
    public String visitParagraph(MarkdownToken.Paragraph paragraph) {
        return write(paragraph.children());
    }

    @Override
    public String visitBlockText(MarkdownToken.BlockText blockText) {
        return write(blockText.children());
    }

    @Override
    public String visitHeading(MarkdownToken.Heading heading) {
        return write(heading.children());
    }

    @Override
    public String visitBlankLine(MarkdownToken.BlankLine blankLine) {
        return "";
    }

    @Override
    public String visitList(MarkdownToken.ListBlock list) {
        return write(list.children());
    }

    @Override
    public String visitListItem(MarkdownToken.ListItem listItem) {
        return write(listItem.children());
    }

    @Override
    public String visitBlockCode(MarkdownToken.BlockCode blockCode) {
        lineStart = false;
        return CodeFenceResolver.codeSpan(blockCode.raw());
    }

    @Override
    public String visitBlockQuote(MarkdownToken.BlockQuote blockQuote) {
        return write(blockQuote.children());
    }

    @Override
    public String visitBlockHtml(MarkdownToken.BlockHtml blockHtml) {
        lineStart = false;
        return blockHtml.raw();
    }

    @Override
    public String visitThematicBreak(MarkdownToken.ThematicBreak thematicBreak) {
        return "";
    }

    @Override
    public String visitTable(MarkdownToken.Table table) {
        return write(table.children());
    }

    @Override
    public String visitTableHead(MarkdownToken.TableHead tableHead) {
        return write(tableHead.children());
    }

    @Override
    public String visitTableBody(MarkdownToken.TableBody tableBody) {
        return write(tableBody.children());
    }

    @Override
    public String visitTableRow(MarkdownToken.TableRow tableRow) {
        return write(tableRow.children());
    }

    @Override
    public String visitTableCell(MarkdownToken.TableCell tableCell) {
        return write(tableCell.children());
    }

    @Override
    public String visitUnknown(MarkdownToken.Unknown unknown) {
        if (!unknown.children().isEmpty()) {
            return write(unknown.children());
        }
        lineStart = false;
        return unknown.raw();
    }

    private String target(ReferenceResolver.ResolvedTarget target) {
        Optional<String> label = deduplicator.labelFor(target.url());
        if (label.isPresent()) {
            return "[" + label.get() + "]";
        }
        StringBuilder destination = new StringBuilder("(").append(MarkdownTextEscaper.destination(target.url()));
        if (target.title() != null) {
            destination.append(' ').append(MarkdownTextEscaper.quoteTitle(target.title()));
        }
        return destination.append(')').toString();
    }
}
