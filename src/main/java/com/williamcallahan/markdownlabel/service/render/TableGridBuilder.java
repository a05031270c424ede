package com.williamcallahan.markdownlabel.service.render;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.render.HorizontalAlign;
import com.williamcallahan.markdownlabel.domain.render.Padding;
import com.williamcallahan.markdownlabel.domain.render.TextRole;
import com.williamcallahan.markdownlabel.domain.render.VisualNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flattens a table token into a fixed-column grid of text cells.
 *
 * <p>Head and body sections may hold cells directly or wrap them in rows; both shapes are
 * accepted per child. The column count comes from the first row of the first non-empty
 * section and defaults to one.</p>
 */
final class TableGridBuilder {

    static final double CELL_SPACING = 2;
    static final double TABLE_INSET = 5;

    private static final Set<String> CELL_ALIGNMENTS = Set.of("left", "center", "right");

    private final RenderContext context;

    TableGridBuilder(RenderContext context) {
        this.context = context;
    }

    VisualNode.Grid build(MarkdownToken.Table table) {
        List<VisualNode> cells = new ArrayList<>();
        for (MarkdownToken section : table.children()) {
            if (section instanceof MarkdownToken.TableHead) {
                appendSection(section.children(), true, cells);
            } else if (section instanceof MarkdownToken.TableBody) {
                appendSection(section.children(), false, cells);
            }
        }
        double base = context.style().baseFontSize();
        Padding padding = new Padding(TABLE_INSET, TABLE_INSET, TABLE_INSET, TABLE_INSET + base);
        return new VisualNode.Grid(columnCount(table), CELL_SPACING, padding, cells);
    }

    /**
     * Counts columns from the first row of the first head or body section that has children.
     * @param table table token
     * @return column count, at least one
     */
    static int columnCount(MarkdownToken.Table table) {
        for (MarkdownToken section : table.children()) {
            if (!(section instanceof MarkdownToken.TableHead) && !(section instanceof MarkdownToken.TableBody)) {
                continue;
            }
            List<MarkdownToken> rows = section.children();
            if (rows.isEmpty()) {
                continue;
            }
            MarkdownToken first = rows.get(0);
            if (first instanceof MarkdownToken.TableCell) {
                return Math.max(1, countCells(rows));
            }
            if (first instanceof MarkdownToken.TableRow) {
                return Math.max(1, countCells(first.children()));
            }
        }
        return 1;
    }

    VisualNode.Text cell(MarkdownToken.TableCell cell, boolean head) {
        HorizontalAlign alignment = cellAlignment(cell.align());
        String markup = context.inlineRenderer().render(cell.children());
        return new VisualNode.Text(markup, context.bodyStyle(alignment, head),
            head ? TextRole.TABLE_HEADER_CELL : TextRole.TABLE_CELL);
    }

    private void appendSection(List<MarkdownToken> children, boolean head, List<VisualNode> cells) {
        for (MarkdownToken child : children) {
            if (child instanceof MarkdownToken.TableCell tableCell) {
                cells.add(cell(tableCell, head || tableCell.head()));
            } else if (child instanceof MarkdownToken.TableRow row) {
                for (MarkdownToken rowChild : row.children()) {
                    if (rowChild instanceof MarkdownToken.TableCell tableCell) {
                        cells.add(cell(tableCell, head || tableCell.head()));
                    }
                }
            }
        }
    }

    private HorizontalAlign cellAlignment(String align) {
        if (align != null) {
            String normalized = align.strip().toLowerCase(Locale.ROOT);
            if (CELL_ALIGNMENTS.contains(normalized)) {
                return HorizontalAlign.valueOf(normalized.toUpperCase(Locale.ROOT));
            }
        }
        return context.alignment();
    }

    private static int countCells(List<MarkdownToken> tokens) {
        int count = 0;
        for (MarkdownToken token : tokens) {
            if (token instanceof MarkdownToken.TableCell) {
                count++;
            }
        }
        return count;
    }
}
