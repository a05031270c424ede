package com.williamcallahan.markdownlabel.service.markdown;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.markdownlabel.config.MarkdownLabelProperties;
import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.ParsedDocument;
import com.williamcallahan.markdownlabel.domain.markdown.MarkdownCacheStatsSnapshot;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.VisualNode;
import com.williamcallahan.markdownlabel.service.render.VisualTreeRenderer;
import com.williamcallahan.markdownlabel.service.serialize.MarkdownSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Host-facing entry point: parses Markdown, renders visual trees and writes Markdown back.
 *
 * <p>Parsed documents are immutable and cached by source text, so one cached document can
 * back any number of renders with different styles.</p>
 */
@Service
public class MarkdownLabelService {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownLabelService.class);
    private static final Set<String> LONE_BULLETS = Set.of("-", "*", "+");

    private final FlexmarkTokenConverter tokenConverter;
    private final VisualTreeRenderer visualTreeRenderer;
    private final MarkdownSerializer markdownSerializer;
    private final Cache<String, ParsedDocument> parseCache;
    private final int maxInputLength;
    private final RenderStyle defaultStyle;

    public MarkdownLabelService(MarkdownLabelProperties properties) {
        this.tokenConverter = new FlexmarkTokenConverter();
        this.visualTreeRenderer = new VisualTreeRenderer();
        this.markdownSerializer = new MarkdownSerializer();
        this.maxInputLength = properties.getParse().getMaxInputLength();
        this.defaultStyle = properties.toRenderStyle();
        this.parseCache = Caffeine.newBuilder()
            .maximumSize(properties.getCache().getMaximumSize())
            .expireAfterWrite(properties.getCache().getExpireAfterWrite())
            .recordStats()
            .build();

        logger.info("MarkdownLabelService initialized (cache size {}, max input {})",
            properties.getCache().getMaximumSize(), maxInputLength);
    }

    /**
     * Parses Markdown into tokens and reference definitions.
     *
     * @param markdown Markdown source, may be null
     * @return parsed document, empty for null or empty input
     * @throws MarkdownProcessingException when the parser fails unexpectedly
     */
    public ParsedDocument parse(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return ParsedDocument.empty();
        }
        if (markdown.length() > maxInputLength) {
            logger.warn("Markdown input exceeds maximum length: {} > {}", markdown.length(), maxInputLength);
            markdown = markdown.substring(0, maxInputLength);
        }

        ParsedDocument cached = parseCache.getIfPresent(markdown);
        if (cached != null) {
            logger.debug("Cache hit for markdown parse");
            return cached;
        }

        ParsedDocument document = parseUncached(markdown);
        parseCache.put(markdown, document);
        logger.debug("Parsed markdown of length {} into {} block tokens", markdown.length(), document.tokens().size());
        return document;
    }

    private ParsedDocument parseUncached(String markdown) {
        String trimmed = markdown.strip();
        // A lone marker would otherwise become an empty list.
        if (LONE_BULLETS.contains(trimmed)) {
            return new ParsedDocument(
                List.of(new MarkdownToken.Paragraph(List.of(new MarkdownToken.Text(trimmed)))),
                ReferenceTable.empty());
        }
        try {
            return tokenConverter.parse(markdown);
        } catch (RuntimeException parseFailure) {
            throw new MarkdownProcessingException("Failed to parse markdown", parseFailure);
        }
    }

    /**
     * Parses and renders Markdown.
     *
     * @param markdown Markdown source
     * @param style style for this render
     * @return document container
     */
    public VisualNode.Container render(String markdown, RenderStyle style) {
        ParsedDocument document = parse(markdown);
        return renderTokens(document.tokens(), document.references(), style);
    }

    /**
     * Renders tokens produced elsewhere.
     *
     * @param tokens block tokens
     * @param references reference definitions for reference-style links
     * @param style style for this render, null for the configured default
     * @return document container
     */
    public VisualNode.Container renderTokens(List<MarkdownToken> tokens, ReferenceTable references, RenderStyle style) {
        return visualTreeRenderer.render(tokens, references, style == null ? defaultStyle : style);
    }

    /**
     * Writes a document back to Markdown.
     *
     * @param document tokens with their reference definitions
     * @return Markdown source
     */
    public String toMarkdown(ParsedDocument document) {
        if (document == null) {
            return "";
        }
        return markdownSerializer.serialize(document.tokens(), document.references());
    }

    /**
     * Gets the style configured under {@code markdown.render}.
     *
     * @return default render style
     */
    public RenderStyle defaultStyle() {
        return defaultStyle;
    }

    /**
     * Gets cache statistics for monitoring.
     *
     * @return statistics snapshot
     */
    public MarkdownCacheStatsSnapshot getCacheStats() {
        var stats = parseCache.stats();
        return MarkdownCacheStatsSnapshot.of(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            parseCache.estimatedSize()
        );
    }

    /**
     * Clears the parse cache.
     */
    public void clearCache() {
        parseCache.invalidateAll();
        logger.info("Markdown parse cache cleared");
    }
}
