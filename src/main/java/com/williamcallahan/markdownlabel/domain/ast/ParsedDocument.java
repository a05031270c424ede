package com.williamcallahan.markdownlabel.domain.ast;

import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;

import java.util.List;
import java.util.Objects;

/**
 * A parsed Markdown document: its top-level block tokens plus the reference
 * definitions collected while parsing.
 *
 * @param tokens top-level block tokens in document order
 * @param references link reference definitions keyed by normalized label
 */
public record ParsedDocument(List<MarkdownToken> tokens, ReferenceTable references) {

    public ParsedDocument {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        references = Objects.requireNonNullElse(references, ReferenceTable.empty());
    }

    /**
     * Creates an empty document.
     * @return document with no tokens and no references
     */
    public static ParsedDocument empty() {
        return new ParsedDocument(List.of(), ReferenceTable.empty());
    }
}
