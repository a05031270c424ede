package com.williamcallahan.markdownlabel.domain.ast;

import java.util.List;

/**
 * Plain-text extraction over token subtrees.
 */
public final class TokenText {
    private TokenText() {}

    /**
     * Concatenates the visible text of a token sequence, ignoring all formatting.
     * Soft breaks contribute a space and hard breaks a newline.
     *
     * @param tokens inline tokens
     * @return plain text, empty when there is none
     */
    public static String plainText(List<MarkdownToken> tokens) {
        StringBuilder textBuilder = new StringBuilder();
        appendPlainText(tokens, textBuilder);
        return textBuilder.toString();
    }

    private static void appendPlainText(List<MarkdownToken> tokens, StringBuilder textBuilder) {
        for (MarkdownToken token : tokens) {
            if (token instanceof MarkdownToken.SoftBreak) {
                textBuilder.append(' ');
            } else if (token instanceof MarkdownToken.LineBreak) {
                textBuilder.append('\n');
            } else if (token.children().isEmpty()) {
                textBuilder.append(token.raw());
            } else {
                appendPlainText(token.children(), textBuilder);
            }
        }
    }
}
