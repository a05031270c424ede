package com.williamcallahan.markdownlabel.web;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.ParsedDocument;
import com.williamcallahan.markdownlabel.domain.errors.ApiResponse;
import com.williamcallahan.markdownlabel.domain.markdown.MarkdownAstOutcome;
import com.williamcallahan.markdownlabel.domain.markdown.MarkdownCacheStatsSnapshot;
import com.williamcallahan.markdownlabel.domain.markdown.MarkdownRenderOutcome;
import com.williamcallahan.markdownlabel.domain.markdown.MarkdownRenderRequest;
import com.williamcallahan.markdownlabel.domain.markdown.MarkdownSerializeOutcome;
import com.williamcallahan.markdownlabel.domain.markdown.TokenDocumentRequest;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.VisualNode;
import com.williamcallahan.markdownlabel.service.markdown.MarkdownLabelService;
import com.williamcallahan.markdownlabel.service.markdown.TokenJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST surface for parsing, rendering and serializing Markdown.
 */
@RestController
@RequestMapping("/api/markdown")
@CrossOrigin(origins = "*")
public class MarkdownController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownController.class);
    private static final String SOURCE_MARKDOWN = "markdown";
    private static final String SOURCE_TOKENS = "tokens";

    private final MarkdownLabelService markdownLabelService;
    private final TokenJsonMapper tokenJsonMapper;

    public MarkdownController(MarkdownLabelService markdownLabelService, TokenJsonMapper tokenJsonMapper,
                              ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.markdownLabelService = markdownLabelService;
        this.tokenJsonMapper = tokenJsonMapper;
    }

    /**
     * Renders Markdown into a visual tree.
     *
     * @param request A JSON object with the markdown and optional style overrides:
     *                <pre>{@code
     *                  {
     *                    "content": "Your **markdown** text here.",
     *                    "style": {"baseFontSize": 18, "linkStyle": "styled"}
     *                  }
     *                }</pre>
     * @return the visual tree and the number of top-level tokens
     */
    @PostMapping(value = "/render",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MarkdownRenderOutcome> renderMarkdown(@RequestBody MarkdownRenderRequest request) {
        logger.debug("Rendering markdown of length: {}", request.content().length());
        RenderStyle style = request.style().applyTo(markdownLabelService.defaultStyle());
        ParsedDocument document = markdownLabelService.parse(request.content());
        VisualNode.Container tree = markdownLabelService.renderTokens(document.tokens(), document.references(), style);
        return ResponseEntity.ok(new MarkdownRenderOutcome(tree, document.tokens().size(), SOURCE_MARKDOWN));
    }

    /**
     * Parses Markdown into loose token JSON plus its reference definitions.
     *
     * @param request A JSON object with a {@code content} field
     * @return tokens and references
     */
    @PostMapping(value = "/ast",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MarkdownAstOutcome> parseMarkdown(@RequestBody MarkdownRenderRequest request) {
        ParsedDocument document = markdownLabelService.parse(request.content());
        return ResponseEntity.ok(new MarkdownAstOutcome(
            tokenJsonMapper.writeTokens(document.tokens()),
            tokenJsonMapper.writeReferences(document.references())));
    }

    /**
     * Writes a loose token document back to Markdown.
     *
     * @param request tokens and optional reference definitions
     * @return Markdown source
     */
    @PostMapping(value = "/serialize",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MarkdownSerializeOutcome> serializeTokens(@RequestBody TokenDocumentRequest request) {
        ParsedDocument document = tokenJsonMapper.readDocument(request.tokens(), request.references());
        String markdown = markdownLabelService.toMarkdown(document);
        return ResponseEntity.ok(new MarkdownSerializeOutcome(markdown, document.tokens().size()));
    }

    /**
     * Renders a loose token document into a visual tree.
     *
     * @param request tokens, optional reference definitions and style overrides
     * @return the visual tree and the number of top-level tokens
     */
    @PostMapping(value = "/render/ast",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MarkdownRenderOutcome> renderTokens(@RequestBody TokenDocumentRequest request) {
        ParsedDocument document = tokenJsonMapper.readDocument(request.tokens(), request.references());
        RenderStyle style = request.style().applyTo(markdownLabelService.defaultStyle());
        List<MarkdownToken> tokens = document.tokens();
        VisualNode.Container tree = markdownLabelService.renderTokens(tokens, document.references(), style);
        return ResponseEntity.ok(new MarkdownRenderOutcome(tree, tokens.size(), SOURCE_TOKENS));
    }

    /**
     * Retrieves statistics about the parse cache.
     *
     * @return hit, miss and eviction counts, size and hit rate
     */
    @GetMapping("/cache/stats")
    public ResponseEntity<MarkdownCacheStatsSnapshot> getCacheStats() {
        return ResponseEntity.ok(markdownLabelService.getCacheStats());
    }

    /**
     * Clears the parse cache.
     *
     * @return A status message
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<ApiResponse> clearCache() {
        markdownLabelService.clearCache();
        logger.info("Markdown cache cleared via API");
        return createSuccessResponse("Cache cleared successfully");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException e) {
        return super.handleValidationException(e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return super.handleValidationException(new IllegalArgumentException("Malformed request body", e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleUnexpected(Exception e) {
        logger.error("Markdown request failed", e);
        return handleServiceException(e, "process markdown");
    }
}
