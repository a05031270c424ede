package com.williamcallahan.markdownlabel.service.markdown;

import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlockBase;
import com.vladsch.flexmark.ast.HtmlEntity;
import com.vladsch.flexmark.ast.HtmlInlineBase;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.ImageRef;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.LinkRef;
import com.vladsch.flexmark.ast.ListBlock;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ast.TextBase;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.gfm.strikethrough.Strikethrough;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableBody;
import com.vladsch.flexmark.ext.tables.TableCell;
import com.vladsch.flexmark.ext.tables.TableHead;
import com.vladsch.flexmark.ext.tables.TableRow;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.BlankLine;
import com.vladsch.flexmark.util.ast.Block;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.sequence.BasedSequence;
import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.ParsedDocument;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceDefinition;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import com.williamcallahan.markdownlabel.service.render.NestingDepthGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses Markdown with flexmark and converts flexmark's node tree into typed tokens.
 *
 * <p>Reference definitions are collected into a {@link ReferenceTable}; reference-style
 * links and images become tokens without a URL that carry their label, so resolution happens
 * downstream. References that name no definition stay literal text. Paragraphs inside tight
 * list items become {@code block_text}. Adjacent text runs are merged.</p>
 *
 * <p>Conversion stops descending after {@link #MAX_NODE_DEPTH} levels: a deeper block becomes a
 * paragraph holding {@link NestingDepthGuard#TRUNCATION_TEXT} and a deeper inline node becomes its
 * literal source text.</p>
 */
public class FlexmarkTokenConverter {

    private static final Logger logger = LoggerFactory.getLogger(FlexmarkTokenConverter.class);
    static final String UNKNOWN_TAG_PREFIX = "flexmark:";

    /** Node tree depth kept by conversion; well beyond what rendering shows. */
    static final int MAX_NODE_DEPTH = 6 * NestingDepthGuard.MAX_NESTING_DEPTH + 4;

    private final Parser parser;

    public FlexmarkTokenConverter() {
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                StrikethroughExtension.create()
            ))
            .set(Parser.BLANK_LINES_IN_AST, false)
            .set(Parser.HTML_BLOCK_DEEP_PARSER, false)
            .set(TablesExtension.COLUMN_SPANS, false)
            .set(TablesExtension.APPEND_MISSING_COLUMNS, true)
            .set(TablesExtension.DISCARD_EXTRA_COLUMNS, true)
            .set(TablesExtension.HEADER_SEPARATOR_COLUMN_MATCH, true);
        this.parser = Parser.builder(options).build();
    }

    /**
     * Parses Markdown source into tokens and reference definitions.
     *
     * @param markdown Markdown source
     * @return parsed document
     */
    public ParsedDocument parse(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return ParsedDocument.empty();
        }
        Document document = parser.parse(markdown);
        return convert(document);
    }

    /**
     * Converts an already parsed flexmark document.
     *
     * @param document flexmark document node
     * @return typed tokens with the document's reference definitions
     */
    public ParsedDocument convert(Node document) {
        ReferenceTable references = collectReferences(document);
        List<MarkdownToken> tokens = new Conversion(references).children(document);
        logger.debug("Converted flexmark document into {} block tokens and {} references",
            tokens.size(), references.size());
        return new ParsedDocument(tokens, references);
    }

    private static ReferenceTable collectReferences(Node document) {
        List<ReferenceDefinition> definitions = new ArrayList<>();
        for (Node node : document.getDescendants()) {
            if (node instanceof Reference reference) {
                definitions.add(new ReferenceDefinition(
                    reference.getReference().unescape(),
                    reference.getUrl().unescape(),
                    reference.getTitle().unescape()));
            }
        }
        return ReferenceTable.of(definitions);
    }

    /**
     * One conversion pass over a document.
     */
    private static final class Conversion {
        private final ReferenceTable references;
        private int depth;
        private boolean truncated;

        Conversion(ReferenceTable references) {
            this.references = references;
        }

        List<MarkdownToken> children(Node parent) {
            depth++;
            try {
                List<MarkdownToken> tokens = new ArrayList<>();
                for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
                    convertInto(child, tokens);
                }
                return mergeAdjacentText(tokens);
            } finally {
                depth--;
            }
        }

        private void convertInto(Node node, List<MarkdownToken> tokens) {
            if (depth > MAX_NODE_DEPTH) {
                tokens.add(truncate(node));
            } else if (node instanceof Text || node instanceof HtmlEntity) {
                tokens.add(new MarkdownToken.Text(node.getChars().unescape()));
            } else if (node instanceof TextBase) {
                tokens.addAll(children(node));
            } else if (node instanceof Code code) {
                tokens.add(new MarkdownToken.CodeSpan(codeSpanContent(code.getText())));
            } else if (node instanceof StrongEmphasis) {
                tokens.add(new MarkdownToken.Strong(children(node)));
            } else if (node instanceof Emphasis) {
                tokens.add(new MarkdownToken.Emphasis(children(node)));
            } else if (node instanceof Strikethrough) {
                tokens.add(new MarkdownToken.Strikethrough(children(node)));
            } else if (node instanceof Link link) {
                tokens.add(new MarkdownToken.Link(children(link), link.getUrl().unescape(),
                    titleOrNull(link.getTitle()), null));
            } else if (node instanceof Image image) {
                tokens.add(new MarkdownToken.Image(children(image), image.getUrl().unescape(),
                    titleOrNull(image.getTitle()), null));
            } else if (node instanceof LinkRef linkRef) {
                convertLinkRef(linkRef, tokens);
            } else if (node instanceof ImageRef imageRef) {
                convertImageRef(imageRef, tokens);
            } else if (node instanceof AutoLink autoLink) {
                String text = autoLink.getText().toString();
                tokens.add(MarkdownToken.Link.inline(List.of(new MarkdownToken.Text(text)), autoLink.getUrl().toString()));
            } else if (node instanceof MailLink mailLink) {
                String address = mailLink.getText().toString();
                tokens.add(MarkdownToken.Link.inline(List.of(new MarkdownToken.Text(address)), "mailto:" + address));
            } else if (node instanceof SoftLineBreak) {
                tokens.add(new MarkdownToken.SoftBreak());
            } else if (node instanceof HardLineBreak) {
                tokens.add(new MarkdownToken.LineBreak());
            } else if (node instanceof HtmlInlineBase) {
                tokens.add(new MarkdownToken.InlineHtml(node.getChars().toString()));
            } else if (node instanceof Paragraph) {
                tokens.add(isInTightList(node)
                    ? new MarkdownToken.BlockText(children(node))
                    : new MarkdownToken.Paragraph(children(node)));
            } else if (node instanceof Heading heading) {
                tokens.add(new MarkdownToken.Heading(heading.getLevel(), children(heading)));
            } else if (node instanceof BulletList bulletList) {
                tokens.add(new MarkdownToken.ListBlock(false, 1, String.valueOf(bulletList.getOpeningMarker()),
                    bulletList.isTight(), children(bulletList)));
            } else if (node instanceof OrderedList orderedList) {
                tokens.add(new MarkdownToken.ListBlock(true, orderedList.getStartNumber(),
                    String.valueOf(orderedList.getDelimiter()), orderedList.isTight(), children(orderedList)));
            } else if (node instanceof ListItem) {
                tokens.add(new MarkdownToken.ListItem(children(node)));
            } else if (node instanceof FencedCodeBlock fencedCode) {
                tokens.add(new MarkdownToken.BlockCode(fencedCode.getContentChars().toString(),
                    fencedCode.getInfo().unescape()));
            } else if (node instanceof IndentedCodeBlock indentedCode) {
                tokens.add(new MarkdownToken.BlockCode(indentedCode.getContentChars().toString(), ""));
            } else if (node instanceof BlockQuote) {
                tokens.add(new MarkdownToken.BlockQuote(children(node)));
            } else if (node instanceof ThematicBreak) {
                tokens.add(new MarkdownToken.ThematicBreak());
            } else if (node instanceof HtmlBlockBase) {
                tokens.add(new MarkdownToken.BlockHtml(node.getChars().toString()));
            } else if (node instanceof BlankLine) {
                tokens.add(new MarkdownToken.BlankLine());
            } else if (node instanceof Reference) {
                // collected into the reference table
                return;
            } else if (node instanceof TableBlock) {
                tokens.add(new MarkdownToken.Table(tableSections(node)));
            } else if (node instanceof TableHead) {
                tokens.add(new MarkdownToken.TableHead(tableRows(node)));
            } else if (node instanceof TableBody) {
                tokens.add(new MarkdownToken.TableBody(tableRows(node)));
            } else if (node instanceof TableRow) {
                tokens.add(new MarkdownToken.TableRow(tableCells(node)));
            } else if (node instanceof TableCell cell) {
                tokens.add(tableCell(cell));
            } else {
                logger.debug("Carrying unmapped flexmark node {} as unknown token", node.getClass().getSimpleName());
                tokens.add(new MarkdownToken.Unknown(UNKNOWN_TAG_PREFIX + node.getClass().getSimpleName(),
                    node.getChars().toString(), children(node)));
            }
        }

        private MarkdownToken truncate(Node node) {
            if (!truncated) {
                logger.warn("Markdown nesting exceeds {} levels; truncating deeper content", MAX_NODE_DEPTH);
                truncated = true;
            }
            if (node instanceof Block) {
                return new MarkdownToken.Paragraph(List.of(new MarkdownToken.Text(NestingDepthGuard.TRUNCATION_TEXT)));
            }
            return new MarkdownToken.Text(node.getChars().unescape());
        }

        private void convertLinkRef(LinkRef linkRef, List<MarkdownToken> tokens) {
            String label = referenceLabel(linkRef.getReference(), linkRef.getText());
            if (references.lookup(label).isPresent()) {
                tokens.add(MarkdownToken.Link.reference(children(linkRef), label));
            } else {
                tokens.add(new MarkdownToken.Text(linkRef.getChars().unescape()));
            }
        }

        private void convertImageRef(ImageRef imageRef, List<MarkdownToken> tokens) {
            String label = referenceLabel(imageRef.getReference(), imageRef.getText());
            if (references.lookup(label).isPresent()) {
                tokens.add(new MarkdownToken.Image(children(imageRef), null, null, label));
            } else {
                tokens.add(new MarkdownToken.Text(imageRef.getChars().unescape()));
            }
        }

        // Only head and body sections become tokens; separators and captions are dropped.
        private List<MarkdownToken> tableSections(Node table) {
            List<MarkdownToken> sections = new ArrayList<>();
            for (Node child = table.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof TableHead || child instanceof TableBody) {
                    convertInto(child, sections);
                }
            }
            return sections;
        }

        private List<MarkdownToken> tableRows(Node section) {
            List<MarkdownToken> rows = new ArrayList<>();
            for (Node child = section.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof TableRow) {
                    convertInto(child, rows);
                }
            }
            return rows;
        }

        private List<MarkdownToken> tableCells(Node row) {
            List<MarkdownToken> cells = new ArrayList<>();
            for (Node child = row.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof TableCell cell) {
                    cells.add(tableCell(cell));
                }
            }
            return cells;
        }

        private MarkdownToken.TableCell tableCell(TableCell cell) {
            String align = null;
            if (cell.getAlignment() != null) {
                align = switch (cell.getAlignment()) {
                    case LEFT -> "left";
                    case CENTER -> "center";
                    case RIGHT -> "right";
                    default -> null;
                };
            }
            return new MarkdownToken.TableCell(align, cell.isHeader(), trimEdges(children(cell)));
        }
    }

    // [text][] and [text] use the link text as the label.
    private static String referenceLabel(BasedSequence reference, BasedSequence text) {
        String label = reference == null ? "" : reference.unescape();
        return label.isBlank() && text != null ? text.unescape() : label;
    }

    private static boolean isInTightList(Node paragraph) {
        Node parent = paragraph.getParent();
        return parent instanceof ListItem && parent.getParent() instanceof ListBlock list && list.isTight();
    }

    private static String titleOrNull(BasedSequence title) {
        if (title == null || title.isEmpty()) {
            return null;
        }
        return title.unescape();
    }

    /**
     * Applies code span normalization: line endings become spaces, and one leading and one
     * trailing space are removed when both are present and the content is not all spaces.
     */
    static String codeSpanContent(BasedSequence text) {
        String content = text.toString().replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        if (content.length() >= 2 && content.startsWith(" ") && content.endsWith(" ") && !content.isBlank()) {
            return content.substring(1, content.length() - 1);
        }
        return content;
    }

    private static List<MarkdownToken> mergeAdjacentText(List<MarkdownToken> tokens) {
        if (tokens.size() < 2) {
            return tokens;
        }
        List<MarkdownToken> merged = new ArrayList<>(tokens.size());
        for (MarkdownToken token : tokens) {
            int last = merged.size() - 1;
            if (token instanceof MarkdownToken.Text text && last >= 0
                && merged.get(last) instanceof MarkdownToken.Text previous) {
                merged.set(last, new MarkdownToken.Text(previous.raw() + text.raw()));
            } else {
                merged.add(token);
            }
        }
        return merged;
    }

    // Cell content is trimmed at its outer edges.
    private static List<MarkdownToken> trimEdges(List<MarkdownToken> tokens) {
        if (tokens.isEmpty()) {
            return tokens;
        }
        List<MarkdownToken> trimmed = new ArrayList<>(tokens);
        if (trimmed.get(0) instanceof MarkdownToken.Text first) {
            trimmed.set(0, new MarkdownToken.Text(first.raw().stripLeading()));
        }
        int last = trimmed.size() - 1;
        if (trimmed.get(last) instanceof MarkdownToken.Text lastText) {
            trimmed.set(last, new MarkdownToken.Text(lastText.raw().stripTrailing()));
        }
        trimmed.removeIf(token -> token instanceof MarkdownToken.Text text && text.raw().isEmpty());
        return trimmed;
    }
}
