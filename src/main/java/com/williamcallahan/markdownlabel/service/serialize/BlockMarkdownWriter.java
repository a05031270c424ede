package com.williamcallahan.markdownlabel.service.serialize;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.TokenVisitor;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes block tokens back as Markdown source.
 *
 * <p>An empty {@link Optional} means "no output" (blank lines); an empty string is the
 * output of unknown tags. Both are left out when blocks are joined.</p>
 */
final class BlockMarkdownWriter implements TokenVisitor<Optional<String>> {

    static final String BLOCK_SEPARATOR = "\n\n";

    private final InlineMarkdownWriter inlineWriter;
    private boolean alternateListMarker;

    BlockMarkdownWriter(InlineMarkdownWriter inlineWriter) {
        this.inlineWriter = inlineWriter;
    }

    /**
     * Serializes blocks and joins the non-empty results.
     *
     * @param tokens block tokens
     * @param separator text placed between consecutive blocks
     * @return joined Markdown
     */
    String joinBlocks(List<MarkdownToken> tokens, String separator) {
        List<String> parts = new ArrayList<>(tokens.size());
        MarkdownToken previousBlock = null;
        boolean previousAlternate = false;
        for (MarkdownToken token : tokens) {
            boolean adjacentList = token instanceof MarkdownToken.ListBlock list
                && previousBlock instanceof MarkdownToken.ListBlock previous
                && previous.ordered() == list.ordered();
            // Two adjacent lists of one kind would merge unless their markers differ.
            alternateListMarker = adjacentList && !previousAlternate;
            boolean usedAlternate = alternateListMarker;
            Optional<String> serialized = token.accept(this);
            if (serialized.isEmpty()) {
                continue;
            }
            if (!serialized.get().isEmpty()) {
                parts.add(serialized.get());
                previousBlock = token;
                previousAlternate = usedAlternate;
            }
        }
        return String.join(separator, parts);
    }

    @Override
    public Optional<String> visitParagraph(MarkdownToken.Paragraph paragraph) {
        return Optional.of(inlineWriter.writeLine(paragraph.children()));
    }

    @Override
    public Optional<String> visitBlockText(MarkdownToken.BlockText blockText) {
        return Optional.of(inlineWriter.writeLine(blockText.children()));
    }

    @Override
    public Optional<String> visitHeading(MarkdownToken.Heading heading) {
        int level = RenderStyle.clampHeadingLevel(heading.level());
        String content = inlineWriter.writeLine(heading.children());
        // A trailing run of "#" would be read as a closing sequence.
        if (content.endsWith("#") && !content.endsWith("\\#")) {
            content = content.substring(0, content.length() - 1) + "\\#";
        }
        return Optional.of("#".repeat(level) + " " + content);
    }

    @Override
    public Optional<String> visitBlankLine(MarkdownToken.BlankLine blankLine) {
        return Optional.empty();
    }

    @Override
    public Optional<String> visitList(MarkdownToken.ListBlock list) {
        boolean alternate = alternateListMarker;
        List<String> items = new ArrayList<>(list.children().size());
        for (int index = 0; index < list.children().size(); index++) {
            String marker = list.ordered()
                ? (list.start() + index) + (alternate ? ")" : ".")
                : (alternate ? "*" : "-");
            items.add(prefixItem(marker, itemContent(list.children().get(index), list.tight())));
        }
        return Optional.of(String.join(list.tight() ? "\n" : BLOCK_SEPARATOR, items));
    }

    @Override
    public Optional<String> visitListItem(MarkdownToken.ListItem listItem) {
        return Optional.of(joinBlocks(listItem.children(), BLOCK_SEPARATOR));
    }

    @Override
    public Optional<String> visitBlockCode(MarkdownToken.BlockCode blockCode) {
        String raw = blockCode.raw();
        String fence = CodeFenceResolver.fence(raw, blockCode.info());
        StringBuilder source = new StringBuilder(fence).append(blockCode.info()).append('\n').append(raw);
        if (!raw.isEmpty() && !raw.endsWith("\n")) {
            source.append('\n');
        }
        return Optional.of(source.append(fence).toString());
    }

    @Override
    public Optional<String> visitBlockQuote(MarkdownToken.BlockQuote blockQuote) {
        String inner = joinBlocks(blockQuote.children(), BLOCK_SEPARATOR);
        if (inner.isEmpty()) {
            return Optional.of(">");
        }
        List<String> quoted = new ArrayList<>();
        for (String line : inner.split("\n", -1)) {
            quoted.add(line.isEmpty() ? ">" : "> " + line);
        }
        return Optional.of(String.join("\n", quoted));
    }

    @Override
    public Optional<String> visitBlockHtml(MarkdownToken.BlockHtml blockHtml) {
        return Optional.of(stripTrailingNewlines(blockHtml.raw()));
    }

    @Override
    public Optional<String> visitThematicBreak(MarkdownToken.ThematicBreak thematicBreak) {
        // "---" under a text line would read back as a setext heading
        return Optional.of("***");
    }

    @Override
    public Optional<String> visitTable(MarkdownToken.Table table) {
        List<List<MarkdownToken.TableCell>> headRows = new ArrayList<>();
        List<List<MarkdownToken.TableCell>> bodyRows = new ArrayList<>();
        for (MarkdownToken section : table.children()) {
            if (section instanceof MarkdownToken.TableHead) {
                collectRows(section.children(), headRows);
            } else if (section instanceof MarkdownToken.TableBody) {
                collectRows(section.children(), bodyRows);
            }
        }
        List<List<MarkdownToken.TableCell>> rows = new ArrayList<>(headRows);
        rows.addAll(bodyRows);
        if (rows.isEmpty()) {
            return Optional.of("");
        }
        List<MarkdownToken.TableCell> header = rows.get(0);
        List<String> lines = new ArrayList<>(rows.size() + 1);
        lines.add(tableRow(header));
        List<String> separators = new ArrayList<>(header.size());
        for (MarkdownToken.TableCell cell : header) {
            separators.add(alignmentMarker(cell.align()));
        }
        lines.add("| " + String.join(" | ", separators) + " |");
        for (List<MarkdownToken.TableCell> row : rows.subList(1, rows.size())) {
            lines.add(tableRow(row));
        }
        return Optional.of(String.join("\n", lines));
    }

    @Override
    public Optional<String> visitTableHead(MarkdownToken.TableHead tableHead) {
        return Optional.of("");
    }

    @Override
    public Optional<String> visitTableBody(MarkdownToken.TableBody tableBody) {
        return Optional.of("");
    }

    @Override
    public Optional<String> visitTableRow(MarkdownToken.TableRow tableRow) {
        return Optional.of("");
    }

    @Override
    public Optional<String> visitTableCell(MarkdownToken.TableCell tableCell) {
        return Optional.of("");
    }

    @Override
    public Optional<String> visitUnknown(MarkdownToken.Unknown unknown) {
        return Optional.of("");
    }

    // Inline tokens at block level are written as a line of their own.

    @Override
    public Optional<String> visitText(MarkdownToken.Text text) {
        return inline(text);
    }

    @Override
    public Optional<String> visitStrong(MarkdownToken.Strong strong) {
        return inline(strong);
    }

    @Override
    public Optional<String> visitEmphasis(MarkdownToken.Emphasis emphasis) {
        return inline(emphasis);
    }

    @Override
    public Optional<String> visitStrikethrough(MarkdownToken.Strikethrough strikethrough) {
        return inline(strikethrough);
    }

    @Override
    public Optional<String> visitCodeSpan(MarkdownToken.CodeSpan codeSpan) {
        return inline(codeSpan);
    }

    @Override
    public Optional<String> visitLink(MarkdownToken.Link link) {
        return inline(link);
    }

    @Override
    public Optional<String> visitImage(MarkdownToken.Image image) {
        return inline(image);
    }

    @Override
    public Optional<String> visitSoftBreak(MarkdownToken.SoftBreak softBreak) {
        return Optional.of("");
    }

    @Override
    public Optional<String> visitLineBreak(MarkdownToken.LineBreak lineBreak) {
        return Optional.of("");
    }

    @Override
    public Optional<String> visitInlineHtml(MarkdownToken.InlineHtml inlineHtml) {
        return inline(inlineHtml);
    }

    private Optional<String> inline(MarkdownToken token) {
        return Optional.of(inlineWriter.writeLine(List.of(token)));
    }

    private String itemContent(MarkdownToken item, boolean tight) {
        List<MarkdownToken> blocks = item instanceof MarkdownToken.ListItem ? item.children() : List.of(item);
        return joinBlocks(blocks, tight ? "\n" : BLOCK_SEPARATOR);
    }

    // Continuation lines are indented to the content column: the marker width plus one space.
    private static String prefixItem(String marker, String content) {
        if (content.isEmpty()) {
            return marker;
        }
        String indent = " ".repeat(marker.length() + 1);
        String[] lines = content.split("\n", -1);
        StringBuilder item = new StringBuilder(marker).append(' ').append(lines[0]);
        for (int index = 1; index < lines.length; index++) {
            item.append('\n');
            if (!lines[index].isEmpty()) {
                item.append(indent).append(lines[index]);
            }
        }
        return item.toString();
    }

    private static void collectRows(List<MarkdownToken> children, List<List<MarkdownToken.TableCell>> rows) {
        List<MarkdownToken.TableCell> directCells = new ArrayList<>();
        for (MarkdownToken child : children) {
            if (child instanceof MarkdownToken.TableCell cell) {
                directCells.add(cell);
            } else if (child instanceof MarkdownToken.TableRow row) {
                if (!directCells.isEmpty()) {
                    rows.add(directCells);
                    directCells = new ArrayList<>();
                }
                List<MarkdownToken.TableCell> cells = new ArrayList<>();
                for (MarkdownToken rowChild : row.children()) {
                    if (rowChild instanceof MarkdownToken.TableCell cell) {
                        cells.add(cell);
                    }
                }
                rows.add(cells);
            }
        }
        if (!directCells.isEmpty()) {
            rows.add(directCells);
        }
    }

    private String tableRow(List<MarkdownToken.TableCell> cells) {
        List<String> texts = new ArrayList<>(cells.size());
        for (MarkdownToken.TableCell cell : cells) {
            texts.add(inlineWriter.writeLine(cell.children()));
        }
        return "| " + String.join(" | ", texts) + " |";
    }

    private static String alignmentMarker(String align) {
        if (align == null) {
            return "---";
        }
        return switch (align) {
            case "left" -> ":---";
            case "center" -> ":---:";
            case "right" -> "---:";
            default -> "---";
        };
    }

    private static String stripTrailingNewlines(String raw) {
        int end = raw.length();
        while (end > 0 && raw.charAt(end - 1) == '\n') {
            end--;
        }
        return raw.substring(0, end);
    }
}
