package com.williamcallahan.markdownlabel.service.render;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.TokenText;
import com.williamcallahan.markdownlabel.domain.ast.TokenVisitor;
import com.williamcallahan.markdownlabel.domain.render.LinkStyle;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;

import java.util.List;
import java.util.Objects;

/**
 * Converts inline tokens into one bracket-tag markup string.
 *
 * <p>Every piece of token text is escaped; link destinations are URL-escaped before they
 * enter a {@code ref=} tag. A link nested inside another link contributes only its text,
 * so each rendered link carries exactly one ref tag pair.</p>
 *
 * <p>Instances keep per-pass state and belong to one render call.</p>
 */
public final class InlineMarkupRenderer implements TokenVisitor<String> {

    private final RenderStyle style;
    private final ReferenceResolver referenceResolver;
    private int linkDepth;

    public InlineMarkupRenderer(RenderStyle style, ReferenceResolver referenceResolver) {
        this.style = Objects.requireNonNull(style, "Render style cannot be null");
        this.referenceResolver = Objects.requireNonNull(referenceResolver, "Reference resolver cannot be null");
    }

    /**
     * Renders a token sequence.
     * @param tokens inline tokens
     * @return markup string, empty for no tokens
     */
    public String render(List<MarkdownToken> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return "";
        }
        StringBuilder markup = new StringBuilder();
        for (MarkdownToken token : tokens) {
            markup.append(token.accept(this));
        }
        return markup.toString();
    }

    @Override
    public String visitText(MarkdownToken.Text text) {
        return MarkupEscaper.escape(text.raw());
    }

    @Override
    public String visitStrong(MarkdownToken.Strong strong) {
        return "[b]" + render(strong.children()) + "[/b]";
    }

    @Override
    public String visitEmphasis(MarkdownToken.Emphasis emphasis) {
        return "[i]" + render(emphasis.children()) + "[/i]";
    }

    @Override
    public String visitStrikethrough(MarkdownToken.Strikethrough strikethrough) {
        return "[s]" + render(strikethrough.children()) + "[/s]";
    }

    @Override
    public String visitCodeSpan(MarkdownToken.CodeSpan codeSpan) {
        return "[font=" + MarkupEscaper.escape(style.codeFontName()) + "]"
            + MarkupEscaper.escape(codeSpan.raw()) + "[/font]";
    }

    @Override
    public String visitLink(MarkdownToken.Link link) {
        if (linkDepth > 0) {
            return render(link.children());
        }
        String url = MarkupEscaper.escapeUrl(referenceResolver.resolve(link).url());
        String inner;
        linkDepth++;
        try {
            inner = render(link.children());
        } finally {
            linkDepth--;
        }
        String reference = "[ref=" + url + "]" + inner + "[/ref]";
        if (style.linkStyle() == LinkStyle.STYLED) {
            return "[color=" + style.linkColor().toHex() + "][u]" + reference + "[/u][/color]";
        }
        return reference;
    }

    @Override
    public String visitImage(MarkdownToken.Image image) {
        return MarkupEscaper.escape(TokenText.plainText(image.children()));
    }

    @Override
    public String visitSoftBreak(MarkdownToken.SoftBreak softBreak) {
        return " ";
    }

    @Override
    public String visitLineBreak(MarkdownToken.LineBreak lineBreak) {
        return "\n";
    }

    @Override
    public String visitInlineHtml(MarkdownToken.InlineHtml inlineHtml) {
        return MarkupEscaper.escape(MarkupEscaper.escapeHtml(inlineHtml.raw()));
    }

    @Override
    public String visitParagraph(MarkdownToken.Paragraph paragraph) {
        return outOfContext(paragraph);
    }

    @Override
    public String visitBlockText(MarkdownToken.BlockText blockText) {
        return outOfContext(blockText);
    }

    @Override
    public String visitHeading(MarkdownToken.Heading heading) {
        return outOfContext(heading);
    }

    @Override
    public String visitBlankLine(MarkdownToken.BlankLine blankLine) {
        return "";
    }

    @Override
    public String visitList(MarkdownToken.ListBlock list) {
        return outOfContext(list);
    }

    @Override
    public String visitListItem(MarkdownToken.ListItem listItem) {
        return outOfContext(listItem);
    }

    @Override
    public String visitBlockCode(MarkdownToken.BlockCode blockCode) {
        return outOfContext(blockCode);
    }

    @Override
    public String visitBlockQuote(MarkdownToken.BlockQuote blockQuote) {
        return outOfContext(blockQuote);
    }

    @Override
    public String visitBlockHtml(MarkdownToken.BlockHtml blockHtml) {
        return outOfContext(blockHtml);
    }

    @Override
    public String visitThematicBreak(MarkdownToken.ThematicBreak thematicBreak) {
        return "";
    }

    @Override
    public String visitTable(MarkdownToken.Table table) {
        return outOfContext(table);
    }

    @Override
    public String visitTableHead(MarkdownToken.TableHead tableHead) {
        return outOfContext(tableHead);
    }

    @Override
    public String visitTableBody(MarkdownToken.TableBody tableBody) {
        return outOfContext(tableBody);
    }

    @Override
    public String visitTableRow(MarkdownToken.TableRow tableRow) {
        return outOfContext(tableRow);
    }

    @Override
    public String visitTableCell(MarkdownToken.TableCell tableCell) {
        return outOfContext(tableCell);
    }

    @Override
    public String visitUnknown(MarkdownToken.Unknown unknown) {
        return outOfContext(unknown);
    }

    // Block tokens and unknown tags keep their text: children when present, otherwise the escaped raw.
    private String outOfContext(MarkdownToken token) {
        if (!token.children().isEmpty()) {
            return render(token.children());
        }
        return MarkupEscaper.escape(token.raw());
    }
}
