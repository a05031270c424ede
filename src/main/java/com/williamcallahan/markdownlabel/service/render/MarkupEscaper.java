package com.williamcallahan.markdownlabel.service.render;

/**
 * Escaping for the bracket-tag markup language consumed by hosts.
 *
 * <p>Markup tags are delimited by {@code [} and {@code ]}; the only entities the host
 * understands are {@code &amp;}, {@code &bl;} and {@code &br;}. Everything untrusted that
 * lands in a markup string passes through {@link #escape(String)}, and everything that lands
 * inside a {@code ref=} tag passes through {@link #escapeUrl(String)}.</p>
 */
public final class MarkupEscaper {

    private static final String AMPERSAND_ENTITY = "&amp;";
    private static final String OPEN_BRACKET_ENTITY = "&bl;";
    private static final String CLOSE_BRACKET_ENTITY = "&br;";

    private MarkupEscaper() {}

    /**
     * Escapes markup control characters. {@code &} is replaced first so the entities
     * introduced for brackets are never re-escaped.
     *
     * @param text plain text, may be null
     * @return markup-safe text
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text.replace("&", AMPERSAND_ENTITY)
            .replace("[", OPEN_BRACKET_ENTITY)
            .replace("]", CLOSE_BRACKET_ENTITY);
    }

    /**
     * Inverse of {@link #escape(String)}. Scans left to right so that an escaped
     * {@code &amp;bl;} decodes to the literal text {@code &bl;} rather than a bracket.
     *
     * @param markup escaped text
     * @return original text
     */
    public static String unescape(String markup) {
        if (markup == null || markup.isEmpty()) {
            return "";
        }
        StringBuilder decoded = new StringBuilder(markup.length());
        int index = 0;
        while (index < markup.length()) {
            char current = markup.charAt(index);
            if (current == '&') {
                if (markup.startsWith(AMPERSAND_ENTITY, index)) {
                    decoded.append('&');
                    index += AMPERSAND_ENTITY.length();
                    continue;
                }
                if (markup.startsWith(OPEN_BRACKET_ENTITY, index)) {
                    decoded.append('[');
                    index += OPEN_BRACKET_ENTITY.length();
                    continue;
                }
                if (markup.startsWith(CLOSE_BRACKET_ENTITY, index)) {
                    decoded.append(']');
                    index += CLOSE_BRACKET_ENTITY.length();
                    continue;
                }
            }
            decoded.append(current);
            index++;
        }
        return decoded.toString();
    }

    /**
     * Percent-encodes brackets so a URL can never close the {@code ref=} tag it sits in.
     *
     * @param url destination, may be null
     * @return URL without raw brackets
     */
    public static String escapeUrl(String url) {
        if (url == null || url.isEmpty()) {
            return "";
        }
        return url.replace("[", "%5B").replace("]", "%5D");
    }

    /**
     * Entity-escapes HTML delimiters and quotes. Ampersands are left alone; callers that
     * place the result in markup run it through {@link #escape(String)} afterwards.
     *
     * @param html raw HTML fragment
     * @return fragment with {@code < > " '} replaced by entities
     */
    public static String escapeHtml(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(html.length() + 16);
        for (int index = 0; index < html.length(); index++) {
            char current = html.charAt(index);
            switch (current) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#x27;");
                default -> escaped.append(current);
            }
        }
        return escaped.toString();
    }
}
