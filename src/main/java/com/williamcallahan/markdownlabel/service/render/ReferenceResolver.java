package com.williamcallahan.markdownlabel.service.render;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.TokenText;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceDefinition;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves link and image destinations against a document's reference definitions.
 *
 * <p>An explicit URL always wins. Otherwise the label is looked up, and an empty label
 * ({@code [text][]} or {@code [text]}) falls back to the plain link text. Undefined
 * references resolve to an empty URL.</p>
 */
public final class ReferenceResolver {

    private final ReferenceTable references;

    public ReferenceResolver(ReferenceTable references) {
        this.references = Objects.requireNonNullElse(references, ReferenceTable.empty());
    }

    /**
     * Resolves a link token.
     * @param link link token
     * @return resolved destination
     */
    public ResolvedTarget resolve(MarkdownToken.Link link) {
        return resolve(link.url(), link.title(), link.label(), link.children());
    }

    /**
     * Resolves an image token.
     * @param image image token
     * @return resolved destination
     */
    public ResolvedTarget resolve(MarkdownToken.Image image) {
        return resolve(image.url(), image.title(), image.label(), image.children());
    }

    private ResolvedTarget resolve(String url, String title, String label, List<MarkdownToken> children) {
        if (url != null) {
            return new ResolvedTarget(url, emptyToNull(title), null);
        }
        String effectiveLabel = label == null || label.isBlank() ? TokenText.plainText(children) : label;
        Optional<ReferenceDefinition> definition = references.lookup(effectiveLabel);
        if (definition.isEmpty()) {
            return new ResolvedTarget("", emptyToNull(title), effectiveLabel);
        }
        String resolvedTitle = title != null && !title.isEmpty() ? title : definition.get().title();
        return new ResolvedTarget(definition.get().url(), resolvedTitle, effectiveLabel);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Destination of a link or image after reference lookup.
     *
     * @param url resolved URL, empty when the reference is undefined
     * @param title title, null when absent
     * @param referenceLabel label the destination was looked up by, null for inline destinations
     */
    public record ResolvedTarget(String url, String title, String referenceLabel) {
        public ResolvedTarget {
            url = url == null ? "" : url;
        }

        public boolean isReference() {
            return referenceLabel != null;
        }
    }
}
