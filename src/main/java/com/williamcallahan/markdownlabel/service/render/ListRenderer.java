package com.williamcallahan.markdownlabel.service.render;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.render.ContainerRole;
import com.williamcallahan.markdownlabel.domain.render.Orientation;
import com.williamcallahan.markdownlabel.domain.render.Padding;
import com.williamcallahan.markdownlabel.domain.render.TextRole;
import com.williamcallahan.markdownlabel.domain.render.VisualNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders list tokens into marker/content item rows.
 */
final class ListRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ListRenderer.class);

    private final RenderContext context;
    private final BlockRenderer blockRenderer;

    ListRenderer(RenderContext context, BlockRenderer blockRenderer) {
        this.context = context;
        this.blockRenderer = blockRenderer;
    }

    VisualNode render(MarkdownToken.ListBlock list) {
        NestingDepthGuard guard = context.depthGuard();
        ListState listState = context.listState();
        guard.enter();
        listState.push(list);
        try {
            if (guard.isExceeded()) {
                logger.warn("Nesting depth {} exceeds limit {}; truncating list with {} items",
                    guard.depth(), guard.maxDepth(), list.children().size());
                return blockRenderer.truncationPlaceholder();
            }
            double indent = listState.indent();
            double bottom = listState.bottomSpacing(context.style().baseFontSize());
            Padding padding = context.isRightAligned()
                ? new Padding(0, 0, indent, bottom)
                : new Padding(indent, 0, 0, bottom);

            List<VisualNode> items = new ArrayList<>();
            for (int index = 0; index < list.children().size(); index++) {
                items.add(renderItem(list, list.children().get(index), index));
            }
            return new VisualNode.Container(ContainerRole.LIST, Orientation.VERTICAL, padding, null, items,
                Map.of("ordered", Boolean.toString(list.ordered())));
        } finally {
            listState.pop(list);
            guard.exit();
        }
    }

    private VisualNode renderItem(MarkdownToken.ListBlock list, MarkdownToken item, int index) {
        VisualNode marker = new VisualNode.Text(context.listState().marker(list, index), context.markerStyle(),
            TextRole.LIST_MARKER);
        // A non-item child of a list is rendered as item content as-is.
        List<MarkdownToken> blocks = item instanceof MarkdownToken.ListItem ? item.children() : List.of(item);
        VisualNode content = new VisualNode.Container(ContainerRole.LIST_ITEM_CONTENT, Orientation.VERTICAL,
            Padding.NONE, null, blockRenderer.renderBlocks(blocks), Map.of());
        List<VisualNode> row = context.isRightAligned() ? List.of(content, marker) : List.of(marker, content);
        return new VisualNode.Container(ContainerRole.LIST_ITEM, Orientation.HORIZONTAL, Padding.NONE, null, row,
            Map.of());
    }
}
