package com.williamcallahan.markdownlabel.service.render;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks list depth and ordered-list counters across nested lists.
 */
final class ListState {

    static final double INDENT_UNIT = 20;
    static final String BULLET = "•";

    private final Deque<Integer> counterStarts = new ArrayDeque<>();
    private int listDepth;

    void push(MarkdownToken.ListBlock list) {
        listDepth++;
        if (list.ordered()) {
            counterStarts.push(list.start());
        }
    }

    void pop(MarkdownToken.ListBlock list) {
        if (list.ordered() && !counterStarts.isEmpty()) {
            counterStarts.pop();
        }
        if (listDepth > 0) {
            listDepth--;
        }
    }

    /**
     * Marker for the item at {@code index} of the innermost list.
     */
    String marker(MarkdownToken.ListBlock list, int index) {
        if (!list.ordered()) {
            return BULLET;
        }
        int start = counterStarts.isEmpty() ? list.start() : counterStarts.peek();
        return (start + index) + ".";
    }

    double indent() {
        return listDepth * INDENT_UNIT;
    }

    // Only the outermost list adds a gap below itself.
    double bottomSpacing(double baseFontSize) {
        return listDepth == 1 ? baseFontSize : 0;
    }

    int depth() {
        return listDepth;
    }
}
