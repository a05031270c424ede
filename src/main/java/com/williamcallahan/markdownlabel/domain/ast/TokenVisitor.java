package com.williamcallahan.markdownlabel.domain.ast;

/**
 * Exhaustive dispatch table over {@link MarkdownToken} kinds.
 *
 * <p>Adding a token kind adds a method here, so every renderer and serializer
 * fails to compile until it decides how to handle the new kind.</p>
 *
 * @param <R> result type produced per token
 */
public interface TokenVisitor<R> {

    R visitText(MarkdownToken.Text token);

    R visitStrong(MarkdownToken.Strong token);

    R visitEmphasis(MarkdownToken.Emphasis token);

    R visitStrikethrough(MarkdownToken.Strikethrough token);

    R visitCodeSpan(MarkdownToken.CodeSpan token);

    R visitLink(MarkdownToken.Link token);

    R visitImage(MarkdownToken.Image token);

    R visitSoftBreak(MarkdownToken.SoftBreak token);

    R visitLineBreak(MarkdownToken.LineBreak token);

    R visitInlineHtml(MarkdownToken.InlineHtml token);

    R visitParagraph(MarkdownToken.Paragraph token);

    R visitBlockText(MarkdownToken.BlockText token);

    R visitHeading(MarkdownToken.Heading token);

    R visitBlankLine(MarkdownToken.BlankLine token);

    R visitList(MarkdownToken.ListBlock token);

    R visitListItem(MarkdownToken.ListItem token);

    R visitBlockCode(MarkdownToken.BlockCode token);

    R visitBlockQuote(MarkdownToken.BlockQuote token);

    R visitBlockHtml(MarkdownToken.BlockHtml token);

    R visitThematicBreak(MarkdownToken.ThematicBreak token);

    R visitTable(MarkdownToken.Table token);

    R visitTableHead(MarkdownToken.TableHead token);

    R visitTableBody(MarkdownToken.TableBody token);

    R visitTableRow(MarkdownToken.TableRow token);

    R visitTableCell(MarkdownToken.TableCell token);

    /**
     * Fallback arm for tags without a typed record.
     * @param token carrier of the unrecognized tag
     * @return visitor result
     */
    R visitUnknown(MarkdownToken.Unknown token);
}
