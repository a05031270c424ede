package com.williamcallahan.markdownlabel.service.serialize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Backslash escaping for text, link destinations and titles written back to Markdown.
 */
final class MarkdownTextEscaper {

    private static final String ALWAYS_ESCAPED = "\\*_`[]~<&|";
    private static final String LINE_START_ESCAPED = "#>-+=";
    private static final Pattern ORDERED_MARKER = Pattern.compile("^(\\d{1,9})([.)])");

    private MarkdownTextEscaper() {}

    /**
     * Escapes text so a parser reads it back as the same literal text.
     *
     * @param text literal text
     * @param lineStart whether the text begins a line, where block markers must be neutralized
     * @return escaped text
     */
    static String escapeText(String text, boolean lineStart) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length() + 8);
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (ALWAYS_ESCAPED.indexOf(current) >= 0) {
                escaped.append('\\');
            }
            escaped.append(current);
        }
        // "!" directly before a link would turn it into an image
        if (escaped.charAt(escaped.length() - 1) == '!') {
            escaped.insert(escaped.length() - 1, '\\');
        }
        if (!lineStart) {
            return escaped.toString();
        }
        if (LINE_START_ESCAPED.indexOf(escaped.charAt(0)) >= 0) {
            return "\\" + escaped;
        }
        Matcher orderedMarker = ORDERED_MARKER.matcher(escaped);
        if (orderedMarker.find()) {
            return orderedMarker.replaceFirst("$1\\\\$2");
        }
        return escaped.toString();
    }

    /**
     * Formats a link destination, wrapping it in angle brackets when it is empty or
     * contains characters a bare destination cannot hold.
     *
     * @param url resolved URL
     * @return destination as written inside {@code (...)} or after a reference label
     */
    static String destination(String url) {
        if (url == null || url.isEmpty()) {
            return "<>";
        }
        boolean needsBrackets = false;
        for (int index = 0; index < url.length(); index++) {
            char current = url.charAt(index);
            if (Character.isWhitespace(current) || Character.isISOControl(current)
                || current == '(' || current == ')' || current == '<' || current == '>') {
                needsBrackets = true;
                break;
            }
        }
        if (!needsBrackets) {
            return url;
        }
        return "<" + url.replace("<", "\\<").replace(">", "\\>") + ">";
    }

    /**
     * Quotes a title with double quotes, escaping backslashes and embedded quotes.
     * @param title title text
     * @return quoted title
     */
    static String quoteTitle(String title) {
        return "\"" + title.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
