package com.williamcallahan.markdownlabel.domain.ast;

import java.util.List;

/**
 * Strongly-typed Markdown AST node.
 *
 * <p>Every token kind the renderer and serializer understand is a record nested here.
 * Tokens are immutable; parsers and readers build them once and every consumer only
 * reads them. Tags that no record models are carried by {@link Unknown} so that
 * consumers can apply their documented fallback instead of failing.</p>
 */
public sealed interface MarkdownToken {

    /**
     * Gets the wire tag of this token.
     * @return tag string such as {@code "paragraph"}
     */
    String tag();

    /**
     * Dispatches this token to the matching visitor method.
     * @param visitor dispatch table
     * @param <R> visitor result type
     * @return visitor result
     */
    <R> R accept(TokenVisitor<R> visitor);

    /**
     * Gets the ordered child tokens; empty for leaf tokens.
     * @return immutable child list
     */
    default List<MarkdownToken> children() {
        return List.of();
    }

    /**
     * Gets the raw text carried by leaf tokens; empty when the kind carries none.
     * @return raw text, never null
     */
    default String raw() {
        return "";
    }

    private static List<MarkdownToken> copyChildren(List<MarkdownToken> children) {
        return children == null ? List.of() : List.copyOf(children);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    record Text(String raw) implements MarkdownToken {
        public Text {
            raw = orEmpty(raw);
        }

        @Override
        public String tag() {
            return TokenType.TEXT.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitText(this);
        }
    }

    record Strong(List<MarkdownToken> children) implements MarkdownToken {
        public Strong {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.STRONG.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitStrong(this);
        }
    }

    record Emphasis(List<MarkdownToken> children) implements MarkdownToken {
        public Emphasis {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.EMPHASIS.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitEmphasis(this);
        }
    }

    record Strikethrough(List<MarkdownToken> children) implements MarkdownToken {
        public Strikethrough {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.STRIKETHROUGH.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitStrikethrough(this);
        }
    }

    record CodeSpan(String raw) implements MarkdownToken {
        public CodeSpan {
            raw = orEmpty(raw);
        }

        @Override
        public String tag() {
            return TokenType.CODESPAN.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitCodeSpan(this);
        }
    }

    /**
     * Hyperlink. {@code url} is null for reference-style links, which are resolved
     * through {@code label} (or the link text when the label is blank).
     */
    record Link(List<MarkdownToken> children, String url, String title, String label) implements MarkdownToken {
        public Link {
            children = copyChildren(children);
        }

        /**
         * Creates an inline link with an explicit destination.
         * @param children link text tokens
         * @param url destination
         * @return link token without title or label
         */
        public static Link inline(List<MarkdownToken> children, String url) {
            return new Link(children, url, null, null);
        }

        /**
         * Creates a reference-style link resolved later by label.
         * @param children link text tokens
         * @param label reference label, blank for implicit {@code [text][]} references
         * @return link token without destination
         */
        public static Link reference(List<MarkdownToken> children, String label) {
            return new Link(children, null, null, label);
        }

        @Override
        public String tag() {
            return TokenType.LINK.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitLink(this);
        }
    }

    /**
     * Image; children hold the alt text. Resolution rules match {@link Link}.
     */
    record Image(List<MarkdownToken> children, String url, String title, String label) implements MarkdownToken {
        public Image {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.IMAGE.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitImage(this);
        }
    }

    record SoftBreak() implements MarkdownToken {
        @Override
        public String tag() {
            return TokenType.SOFTBREAK.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitSoftBreak(this);
        }
    }

    record LineBreak() implements MarkdownToken {
        @Override
        public String tag() {
            return TokenType.LINEBREAK.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitLineBreak(this);
        }
    }

    record InlineHtml(String raw) implements MarkdownToken {
        public InlineHtml {
            raw = orEmpty(raw);
        }

        @Override
        public String tag() {
            return TokenType.INLINE_HTML.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitInlineHtml(this);
        }
    }

    record Paragraph(List<MarkdownToken> children) implements MarkdownToken {
        public Paragraph {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.PARAGRAPH.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitParagraph(this);
        }
    }

    /**
     * Inline content of a tight list item.
     */
    record BlockText(List<MarkdownToken> children) implements MarkdownToken {
        public BlockText {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.BLOCK_TEXT.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitBlockText(this);
        }
    }

    record Heading(int level, List<MarkdownToken> children) implements MarkdownToken {
        public Heading {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.HEADING.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitHeading(this);
        }
    }

    record BlankLine() implements MarkdownToken {
        @Override
        public String tag() {
            return TokenType.BLANK_LINE.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitBlankLine(this);
        }
    }

    /**
     * Ordered or unordered list. {@code bullet} is the source marker character
     * ({@code -}, {@code *}, {@code +} or the ordered delimiter) and is cosmetic.
     */
    record ListBlock(boolean ordered, int start, String bullet, boolean tight, List<MarkdownToken> children)
        implements MarkdownToken {
        public ListBlock {
            bullet = orEmpty(bullet);
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.LIST.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    record ListItem(List<MarkdownToken> children) implements MarkdownToken {
        public ListItem {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.LIST_ITEM.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitListItem(this);
        }
    }

    /**
     * Code block; {@code info} is the fence language identifier, empty when absent.
     */
    record BlockCode(String raw, String info) implements MarkdownToken {
        public BlockCode {
            raw = orEmpty(raw);
            info = orEmpty(info);
        }

        @Override
        public String tag() {
            return TokenType.BLOCK_CODE.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitBlockCode(this);
        }
    }

    record BlockQuote(List<MarkdownToken> children) implements MarkdownToken {
        public BlockQuote {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.BLOCK_QUOTE.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitBlockQuote(this);
        }
    }

    record BlockHtml(String raw) implements MarkdownToken {
        public BlockHtml {
            raw = orEmpty(raw);
        }

        @Override
        public String tag() {
            return TokenType.BLOCK_HTML.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitBlockHtml(this);
        }
    }

    record ThematicBreak() implements MarkdownToken {
        @Override
        public String tag() {
            return TokenType.THEMATIC_BREAK.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitThematicBreak(this);
        }
    }

    record Table(List<MarkdownToken> children) implements MarkdownToken {
        public Table {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.TABLE.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitTable(this);
        }
    }

    /**
     * Table header section. Children are either cells directly or row wrappers,
     * depending on the producing parser.
     */
    record TableHead(List<MarkdownToken> children) implements MarkdownToken {
        public TableHead {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.TABLE_HEAD.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitTableHead(this);
        }
    }

    record TableBody(List<MarkdownToken> children) implements MarkdownToken {
        public TableBody {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.TABLE_BODY.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitTableBody(this);
        }
    }

    record TableRow(List<MarkdownToken> children) implements MarkdownToken {
        public TableRow {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.TABLE_ROW.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitTableRow(this);
        }
    }

    /**
     * Table cell. {@code align} is kept as written by the parser (null when unspecified);
     * consumers validate it.
     */
    record TableCell(String align, boolean head, List<MarkdownToken> children) implements MarkdownToken {
        public TableCell {
            children = copyChildren(children);
        }

        @Override
        public String tag() {
            return TokenType.TABLE_CELL.tag();
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitTableCell(this);
        }
    }

    /**
     * Carrier for tags no other record models.
     */
    record Unknown(String tag, String raw, List<MarkdownToken> children) implements MarkdownToken {
        public Unknown {
            tag = orEmpty(tag);
            raw = orEmpty(raw);
            children = copyChildren(children);
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitUnknown(this);
        }
    }
}
