package com.williamcallahan.markdownlabel.service.markdown;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.ParsedDocument;
import com.williamcallahan.markdownlabel.domain.ast.TokenType;
import com.williamcallahan.markdownlabel.domain.ast.TokenVisitor;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceDefinition;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between the loose JSON token shape and typed tokens.
 *
 * <p>The loose shape is {@code {"type", "raw"?, "children"?, "attrs"?}} with list-level
 * {@code "tight"} and {@code "bullet"} fields beside {@code attrs}. Missing fields take
 * defaults: heading level 1, list start 1, tight lists, empty raw text and children, and
 * no URL. Unrecognized types become {@link MarkdownToken.Unknown}. Only structurally
 * unusable documents, such as a token that is not a JSON object, are rejected with
 * {@link TokenFormatException}.</p>
 */
@Component
public class TokenJsonMapper {

    private static final String TYPE = "type";
    private static final String RAW = "raw";
    private static final String CHILDREN = "children";
    private static final String ATTRS = "attrs";
    private static final String TIGHT = "tight";
    private static final String BULLET = "bullet";
    private static final String TOKENS = "tokens";
    private static final String REFERENCES = "references";
    private static final String LABEL = "label";
    private static final String URL = "url";
    private static final String TITLE = "title";
    static final int MAX_LIST_START = 999_999_999;

    private final ObjectMapper objectMapper;

    public TokenJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
    }

    /**
     * Reads a document from JSON text holding either a token array or an object with
     * {@code tokens} and optional {@code references}.
     *
     * @param json JSON text
     * @return typed document
     * @throws TokenFormatException when the text is not JSON or not a token document
     */
    public ParsedDocument readDocument(String json) {
        try {
            return readDocument(objectMapper.readTree(json), null);
        } catch (JsonProcessingException parseFailure) {
            throw new TokenFormatException("Token document is not valid JSON: " + parseFailure.getOriginalMessage(),
                parseFailure);
        }
    }

    /**
     * Reads a document from a token node and a separate references node.
     *
     * @param tokens token array, or an object carrying {@code tokens} and {@code references}
     * @param references reference definitions; ignored when {@code tokens} carries its own
     * @return typed document
     */
    public ParsedDocument readDocument(JsonNode tokens, JsonNode references) {
        if (tokens != null && tokens.isObject() && tokens.has(TOKENS)) {
            JsonNode embeddedReferences = tokens.has(REFERENCES) ? tokens.get(REFERENCES) : references;
            return new ParsedDocument(readTokens(tokens.get(TOKENS)), readReferences(embeddedReferences));
        }
        return new ParsedDocument(readTokens(tokens), readReferences(references));
    }

    /**
     * Reads a token list; a single token object is accepted as a one-element list.
     *
     * @param node JSON array or object, null or JSON null for no tokens
     * @return typed tokens
     */
    public List<MarkdownToken> readTokens(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (node.isObject()) {
            return List.of(readToken(node));
        }
        if (!node.isArray()) {
            throw new TokenFormatException("Token document must be a JSON array or object, got " + node.getNodeType());
        }
        List<MarkdownToken> tokens = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            tokens.add(readToken(element));
        }
        return tokens;
    }

    /**
     * Reads reference definitions from an array of {@code {label, url, title}} objects or
     * from an object keyed by label whose values are URL strings or {@code {url, title}}.
     *
     * @param node references node, may be null
     * @return reference table, empty when absent
     */
    public ReferenceTable readReferences(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ReferenceTable.empty();
        }
        List<ReferenceDefinition> definitions = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (!element.isObject()) {
                    throw new TokenFormatException("Reference definition must be a JSON object");
                }
                definitions.add(new ReferenceDefinition(text(element, LABEL, ""), text(element, URL, ""),
                    text(element, TITLE, null)));
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isTextual()) {
                    definitions.add(new ReferenceDefinition(field.getKey(), value.asText(), null));
                } else {
                    definitions.add(new ReferenceDefinition(field.getKey(), text(value, URL, ""),
                        text(value, TITLE, null)));
                }
            }
        } else {
            throw new TokenFormatException("References must be a JSON array or object, got " + node.getNodeType());
        }
        return ReferenceTable.of(definitions);
    }

    private MarkdownToken readToken(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new TokenFormatException("Token must be a JSON object, got "
                + (node == null ? "nothing" : node.getNodeType()));
        }
        String type = text(node, TYPE, "");
        String raw = text(node, RAW, "");
        JsonNode attrs = node.path(ATTRS);
        List<MarkdownToken> children = node.has(CHILDREN) ? readTokens(node.get(CHILDREN)) : List.of();

        TokenType tokenType = TokenType.fromTag(type).orElse(null);
        if (tokenType == null) {
            return new MarkdownToken.Unknown(type, raw, children);
        }
        return switch (tokenType) {
            case TEXT -> new MarkdownToken.Text(raw);
            case STRONG -> new MarkdownToken.Strong(children);
            case EMPHASIS -> new MarkdownToken.Emphasis(children);
            case STRIKETHROUGH -> new MarkdownToken.Strikethrough(children);
            case CODESPAN -> new MarkdownToken.CodeSpan(raw);
            case LINK -> new MarkdownToken.Link(children, text(attrs, URL, null), text(attrs, TITLE, null),
                text(attrs, LABEL, null));
            case IMAGE -> new MarkdownToken.Image(children, text(attrs, URL, null), text(attrs, TITLE, null),
                text(attrs, LABEL, null));
            case SOFTBREAK -> new MarkdownToken.SoftBreak();
            case LINEBREAK -> new MarkdownToken.LineBreak();
            case INLINE_HTML -> new MarkdownToken.InlineHtml(raw);
            case PARAGRAPH -> new MarkdownToken.Paragraph(children);
            case BLOCK_TEXT -> new MarkdownToken.BlockText(children);
            case HEADING -> new MarkdownToken.Heading(attrs.path("level").asInt(1), children);
            case BLANK_LINE -> new MarkdownToken.BlankLine();
            case LIST -> new MarkdownToken.ListBlock(attrs.path("ordered").asBoolean(false),
                listStart(attrs), text(node, BULLET, ""), node.path(TIGHT).asBoolean(true), children);
            case LIST_ITEM -> new MarkdownToken.ListItem(children);
            case BLOCK_CODE -> new MarkdownToken.BlockCode(raw, text(attrs, "info", ""));
            case BLOCK_QUOTE -> new MarkdownToken.BlockQuote(children);
            case BLOCK_HTML -> new MarkdownToken.BlockHtml(raw);
            case THEMATIC_BREAK -> new MarkdownToken.ThematicBreak();
            case TABLE -> new MarkdownToken.Table(children);
            case TABLE_HEAD -> new MarkdownToken.TableHead(children);
            case TABLE_BODY -> new MarkdownToken.TableBody(children);
            case TABLE_ROW -> new MarkdownToken.TableRow(children);
            case TABLE_CELL -> new MarkdownToken.TableCell(text(attrs, "align", null),
                attrs.path("head").asBoolean(false), children);
        };
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        return value.asText();
    }

    // Ordered list numbers have at most nine digits.
    private static int listStart(JsonNode attrs) {
        long start = attrs.path("start").asLong(1);
        return (int) Math.max(0, Math.min(MAX_LIST_START, start));
    }

    /**
     * Writes tokens in the loose shape.
     *
     * @param tokens typed tokens
     * @return JSON array
     */
    public ArrayNode writeTokens(List<MarkdownToken> tokens) {
        ArrayNode array = objectMapper.createArrayNode();
        if (tokens != null) {
            TokenWriter writer = new TokenWriter();
            for (MarkdownToken token : tokens) {
                array.add(token.accept(writer));
            }
        }
        return array;
    }

    /**
     * Writes reference definitions as an array of {@code {label, url, title?}} objects.
     *
     * @param references reference table
     * @return JSON array in document order
     */
    public ArrayNode writeReferences(ReferenceTable references) {
        ArrayNode array = objectMapper.createArrayNode();
        if (references == null) {
            return array;
        }
        for (ReferenceDefinition definition : references.definitions()) {
            ObjectNode entry = array.addObject();
            entry.put(LABEL, definition.label());
            entry.put(URL, definition.url());
            if (definition.hasTitle()) {
                entry.put(TITLE, definition.title());
            }
        }
        return array;
    }

    private final class TokenWriter implements TokenVisitor<ObjectNode> {

        private ObjectNode node(MarkdownToken token) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put(TYPE, token.tag());
            return node;
        }

        private ObjectNode leaf(MarkdownToken token) {
            ObjectNode node = node(token);
            node.put(RAW, token.raw());
            return node;
        }

        private ObjectNode parent(MarkdownToken token) {
            ObjectNode node = node(token);
            ArrayNode children = node.putArray(CHILDREN);
            for (MarkdownToken child : token.children()) {
                children.add(child.accept(this));
            }
            return node;
        }

        private ObjectNode linkTarget(ObjectNode node, String url, String title, String label) {
            ObjectNode attrs = node.putObject(ATTRS);
            if (url != null) {
                attrs.put(URL, url);
            }
            if (title != null) {
                attrs.put(TITLE, title);
            }
            if (label != null) {
                attrs.put(LABEL, label);
            }
            return node;
        }

        @Override
        public ObjectNode visitText(MarkdownToken.Text token) {
            return leaf(token);
        }

        @Override
        public ObjectNode visitStrong(MarkdownToken.Strong token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitEmphasis(MarkdownToken.Emphasis token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitStrikethrough(MarkdownToken.Strikethrough token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitCodeSpan(MarkdownToken.CodeSpan token) {
            return leaf(token);
        }

        @Override
        public ObjectNode visitLink(MarkdownToken.Link token) {
            return linkTarget(parent(token), token.url(), token.title(), token.label());
        }

        @Override
        public ObjectNode visitImage(MarkdownToken.Image token) {
            return linkTarget(parent(token), token.url(), token.title(), token.label());
        }

        @Override
        public ObjectNode visitSoftBreak(MarkdownToken.SoftBreak token) {
            return node(token);
        }

        @Override
        public ObjectNode visitLineBreak(MarkdownToken.LineBreak token) {
            return node(token);
        }

        @Override
        public ObjectNode visitInlineHtml(MarkdownToken.InlineHtml token) {
            return leaf(token);
        }

        @Override
        public ObjectNode visitParagraph(MarkdownToken.Paragraph token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitBlockText(MarkdownToken.BlockText token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitHeading(MarkdownToken.Heading token) {
            ObjectNode node = parent(token);
            node.putObject(ATTRS).put("level", token.level());
            return node;
        }

        @Override
        public ObjectNode visitBlankLine(MarkdownToken.BlankLine token) {
            return node(token);
        }

        @Override
        public ObjectNode visitList(MarkdownToken.ListBlock token) {
            ObjectNode node = parent(token);
            node.put(TIGHT, token.tight());
            node.put(BULLET, token.bullet());
            ObjectNode attrs = node.putObject(ATTRS);
            attrs.put("ordered", token.ordered());
            if (token.ordered()) {
                attrs.put("start", token.start());
            }
            return node;
        }

        @Override
        public ObjectNode visitListItem(MarkdownToken.ListItem token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitBlockCode(MarkdownToken.BlockCode token) {
            ObjectNode node = leaf(token);
            if (!token.info().isEmpty()) {
                node.putObject(ATTRS).put("info", token.info());
            }
            return node;
        }

        @Override
        public ObjectNode visitBlockQuote(MarkdownToken.BlockQuote token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitBlockHtml(MarkdownToken.BlockHtml token) {
            return leaf(token);
        }

        @Override
        public ObjectNode visitThematicBreak(MarkdownToken.ThematicBreak token) {
            return node(token);
        }

        @Override
        public ObjectNode visitTable(MarkdownToken.Table token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitTableHead(MarkdownToken.TableHead token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitTableBody(MarkdownToken.TableBody token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitTableRow(MarkdownToken.TableRow token) {
            return parent(token);
        }

        @Override
        public ObjectNode visitTableCell(MarkdownToken.TableCell token) {
            ObjectNode node = parent(token);
            ObjectNode attrs = node.putObject(ATTRS);
            if (token.align() == null) {
                attrs.putNull("align");
            } else {
                attrs.put("align", token.align());
            }
            attrs.put("head", token.head());
            return node;
        }

        @Override
        public ObjectNode visitUnknown(MarkdownToken.Unknown token) {
            ObjectNode node = parent(token);
            node.put(RAW, token.raw());
            return node;
        }
    }
}
