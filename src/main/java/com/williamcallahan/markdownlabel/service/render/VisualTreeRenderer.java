package com.williamcallahan.markdownlabel.service.render;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import com.williamcallahan.markdownlabel.domain.render.ContainerRole;
import com.williamcallahan.markdownlabel.domain.render.Orientation;
import com.williamcallahan.markdownlabel.domain.render.Padding;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.VisualNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the render path: block tokens in, one document container out.
 *
 * <p>Stateless and safe to share. Each call builds a fresh render context, so concurrent
 * or re-entrant calls never observe each other's nesting or list counters, and rendering
 * the same tokens with the same style always yields an equal tree.</p>
 */
public final class VisualTreeRenderer {

    private static final Logger logger = LoggerFactory.getLogger(VisualTreeRenderer.class);

    /**
     * Renders a document with no reference definitions.
     *
     * @param tokens top-level block tokens
     * @param style styling for this pass
     * @return document container
     */
    public VisualNode.Container render(List<MarkdownToken> tokens, RenderStyle style) {
        return render(tokens, ReferenceTable.empty(), style);
    }

    /**
     * Renders a document.
     *
     * @param tokens top-level block tokens
     * @param references definitions used to resolve reference-style links and images
     * @param style styling for this pass
     * @return document container
     */
    public VisualNode.Container render(List<MarkdownToken> tokens, ReferenceTable references, RenderStyle style) {
        Objects.requireNonNull(style, "Render style cannot be null");
        List<MarkdownToken> blocks = tokens == null ? List.of() : tokens;
        BlockRenderer blockRenderer = new BlockRenderer(new RenderContext(style, references));
        List<VisualNode> children = blockRenderer.renderBlocks(blocks);
        logger.debug("Rendered {} block tokens into {} visual nodes", blocks.size(), children.size());
        return new VisualNode.Container(ContainerRole.DOCUMENT, Orientation.VERTICAL, Padding.NONE, null, children,
            Map.of());
    }
}
