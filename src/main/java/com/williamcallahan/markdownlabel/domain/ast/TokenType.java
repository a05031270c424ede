package com.williamcallahan.markdownlabel.domain.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enumerates the token tags understood by the renderer and serializer.
 *
 * <p>The tag strings match the loose token shape produced by external parsers,
 * so a token read from JSON can be mapped to its typed record by tag.</p>
 */
public enum TokenType {
    TEXT("text"),
    STRONG("strong"),
    EMPHASIS("emphasis"),
    CODESPAN("codespan"),
    STRIKETHROUGH("strikethrough"),
    LINK("link"),
    IMAGE("image"),
    SOFTBREAK("softbreak"),
    LINEBREAK("linebreak"),
    INLINE_HTML("inline_html"),
    PARAGRAPH("paragraph"),
    BLOCK_TEXT("block_text"),
    HEADING("heading"),
    BLANK_LINE("blank_line"),
    LIST("list"),
    LIST_ITEM("list_item"),
    BLOCK_CODE("block_code"),
    BLOCK_QUOTE("block_quote"),
    BLOCK_HTML("block_html"),
    THEMATIC_BREAK("thematic_break"),
    TABLE("table"),
    TABLE_HEAD("table_head"),
    TABLE_BODY("table_body"),
    TABLE_ROW("table_row"),
    TABLE_CELL("table_cell");

    private static final Map<String, TokenType> BY_TAG = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(TokenType::tag, Function.identity()));

    private final String tag;

    TokenType(String tag) {
        this.tag = tag;
    }

    /**
     * Gets the wire tag for this token type.
     * @return tag string such as {@code "block_code"}
     */
    public String tag() {
        return tag;
    }

    /**
     * Looks up a token type by its wire tag.
     * @param tag tag string, may be null
     * @return the matching type, or empty for unrecognized tags
     */
    public static Optional<TokenType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}
