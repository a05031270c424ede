package com.williamcallahan.markdownlabel.service.markdown;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import com.williamcallahan.markdownlabel.service.render.ReferenceResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces token trees to the details Markdown source can express, so a parse of serialized
 * output compares equal to the original: blank lines dropped, soft breaks as spaces, bullets
 * unified, link targets resolved and adjacent text merged.
 */
final class RoundTripNormalizer {

    private final ReferenceResolver resolver;

    RoundTripNormalizer(ReferenceTable references) {
        this.resolver = new ReferenceResolver(references);
    }

    List<MarkdownToken> normalize(List<MarkdownToken> tokens) {
        List<MarkdownToken> normalized = new ArrayList<>();
        for (MarkdownToken token : tokens) {
            if (token instanceof MarkdownToken.BlankLine) {
                continue;
            }
            MarkdownToken result = normalize(token);
            int last = normalized.size() - 1;
            if (result instanceof MarkdownToken.Text text && last >= 0
                && normalized.get(last) instanceof MarkdownToken.Text previous) {
                normalized.set(last, new MarkdownToken.Text(previous.raw() + text.raw()));
            } else {
                normalized.add(result);
            }
        }
        return normalized;
    }

    private MarkdownToken normalize(MarkdownToken token) {
        if (token instanceof MarkdownToken.SoftBreak) {
            return new MarkdownToken.Text(" ");
        }
        if (token instanceof MarkdownToken.ListBlock list) {
            String bullet = list.ordered() ? "" : "-";
            return new MarkdownToken.ListBlock(list.ordered(), list.ordered() ? list.start() : 1, bullet, list.tight(),
                normalize(list.children()));
        }
        if (token instanceof MarkdownToken.Link link) {
            ReferenceResolver.ResolvedTarget target = resolver.resolve(link);
            return new MarkdownToken.Link(normalize(link.children()), target.url(), target.title(), null);
        }
        if (token instanceof MarkdownToken.Image image) {
            ReferenceResolver.ResolvedTarget target = resolver.resolve(image);
            return new MarkdownToken.Image(normalize(image.children()), target.url(), target.title(), null);
        }
        return rebuild(token);
    }

    private MarkdownToken rebuild(MarkdownToken token) {
        List<MarkdownToken> children = normalize(token.children());
        if (token instanceof MarkdownToken.Strong) {
            return new MarkdownToken.Strong(children);
        } else if (token instanceof MarkdownToken.Emphasis) {
            return new MarkdownToken.Emphasis(children);
        } else if (token instanceof MarkdownToken.Strikethrough) {
            return new MarkdownToken.Strikethrough(children);
        } else if (token instanceof MarkdownToken.Paragraph) {
            return new MarkdownToken.Paragraph(children);
        } else if (token instanceof MarkdownToken.BlockText) {
            return new MarkdownToken.BlockText(children);
        } else if (token instanceof MarkdownToken.Heading heading) {
            return new MarkdownToken.Heading(heading.level(), children);
        } else if (token instanceof MarkdownToken.ListItem) {
            return new MarkdownToken.ListItem(children);
        } else if (token instanceof MarkdownToken.BlockQuote) {
            return new MarkdownToken.BlockQuote(children);
        } else if (token instanceof MarkdownToken.Table) {
            return new MarkdownToken.Table(children);
        } else if (token instanceof MarkdownToken.TableHead) {
            return new MarkdownToken.TableHead(children);
        } else if (token instanceof MarkdownToken.TableBody) {
            return new MarkdownToken.TableBody(children);
        } else if (token instanceof MarkdownToken.TableRow) {
            return new MarkdownToken.TableRow(children);
        } else if (token instanceof MarkdownToken.TableCell cell) {
            return new MarkdownToken.TableCell(cell.align(), cell.head(), children);
        }
        return token;
    }
}
