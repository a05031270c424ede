package com.williamcallahan.markdownlabel.domain.render;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Layout-ready node produced by rendering. Hosts measure and paint these;
 * the renderer never mutates a node after constructing it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = VisualNode.Text.class, name = "text"),
    @JsonSubTypes.Type(value = VisualNode.Container.class, name = "container"),
    @JsonSubTypes.Type(value = VisualNode.Grid.class, name = "grid"),
    @JsonSubTypes.Type(value = VisualNode.Image.class, name = "image"),
    @JsonSubTypes.Type(value = VisualNode.Spacer.class, name = "spacer"),
    @JsonSubTypes.Type(value = VisualNode.Rule.class, name = "rule")
})
public sealed interface VisualNode {

    /**
     * A run of rich-text markup.
     *
     * @param markup markup string; plain text when {@code style.markup()} is false
     * @param style resolved text style
     * @param role construct this text displays
     */
    record Text(String markup, TextStyle style, TextRole role) implements VisualNode {
        public Text {
            Objects.requireNonNull(markup, "Markup cannot be null");
            Objects.requireNonNull(style, "Text style cannot be null");
            Objects.requireNonNull(role, "Text role cannot be null");
        }
    }

    /**
     * Stacks children in one direction.
     *
     * @param role construct this container was built for
     * @param orientation stacking direction
     * @param padding inner insets
     * @param background fill color, null for transparent
     * @param children ordered children
     * @param attributes construct metadata such as a code block's language
     */
    record Container(
        ContainerRole role,
        Orientation orientation,
        Padding padding,
        Rgba background,
        List<VisualNode> children,
        Map<String, String> attributes
    ) implements VisualNode {
        public Container {
            Objects.requireNonNull(role, "Container role cannot be null");
            Objects.requireNonNull(orientation, "Orientation cannot be null");
            padding = Objects.requireNonNullElse(padding, Padding.NONE);
            children = children == null ? List.of() : List.copyOf(children);
            attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        }
    }

    /**
     * Fixed-column grid; cells fill left to right, top to bottom.
     *
     * @param columns column count, at least one
     * @param spacing gap between cells
     * @param padding inner insets
     * @param cells ordered cells
     */
    record Grid(int columns, double spacing, Padding padding, List<VisualNode> cells) implements VisualNode {
        public Grid {
            if (columns < 1) {
                throw new IllegalArgumentException("Grid must have at least one column");
            }
            padding = Objects.requireNonNullElse(padding, Padding.NONE);
            cells = cells == null ? List.of() : List.copyOf(cells);
        }
    }

    /**
     * An image the host loads from {@code source}; {@code altText} is shown until it loads or on failure.
     *
     * @param source image URL
     * @param altText plain alternative text
     */
    record Image(String source, String altText) implements VisualNode {
        public Image {
            source = source == null ? "" : source;
            altText = altText == null ? "" : altText;
        }
    }

    /**
     * Empty vertical space.
     *
     * @param size height of the gap
     */
    record Spacer(double size) implements VisualNode {
    }

    /**
     * Horizontal rule.
     *
     * @param height height of the box the rule is centered in
     * @param thickness stroke width
     * @param color stroke color
     */
    record Rule(double height, double thickness, Rgba color) implements VisualNode {
    }
}
