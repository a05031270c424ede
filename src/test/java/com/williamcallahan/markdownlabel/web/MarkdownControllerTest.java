package com.williamcallahan.markdownlabel.web;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.ast.ParsedDocument;
import com.williamcallahan.markdownlabel.domain.markdown.MarkdownCacheStatsSnapshot;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceDefinition;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import com.williamcallahan.markdownlabel.domain.render.ContainerRole;
import com.williamcallahan.markdownlabel.domain.render.LinkStyle;
import com.williamcallahan.markdownlabel.domain.render.Orientation;
import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.VisualNode;
import com.williamcallahan.markdownlabel.service.markdown.MarkdownLabelService;
import com.williamcallahan.markdownlabel.service.markdown.MarkdownProcessingException;
import com.williamcallahan.markdownlabel.service.markdown.TokenJsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MarkdownController.class)
@Import({TokenJsonMapper.class, ExceptionResponseBuilder.class})
class MarkdownControllerTest {

    private static final String HEADING_MARKDOWN = "# Hi";

    @Autowired
    MockMvc mvc;

    @MockitoBean
    MarkdownLabelService markdownLabelService;

    private static ParsedDocument headingDocument() {
        return new ParsedDocument(
            List.of(new MarkdownToken.Heading(1, List.of(new MarkdownToken.Text("Hi")))),
            ReferenceTable.of(List.of(new ReferenceDefinition("docs", "https://docs.test", null))));
    }

    private static VisualNode.Container emptyTree() {
        return new VisualNode.Container(ContainerRole.DOCUMENT, Orientation.VERTICAL, null, null, List.of(), Map.of());
    }

    @BeforeEach
    void setUp() {
        given(markdownLabelService.defaultStyle()).willReturn(RenderStyle.defaults());
    }

    @Test
    void render_appliesStyleOverridesAndReportsTokenCount() throws Exception {
        given(markdownLabelService.parse(HEADING_MARKDOWN)).willReturn(headingDocument());
        given(markdownLabelService.renderTokens(any(), any(), any())).willReturn(emptyTree());

        mvc.perform(post("/api/markdown/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"# Hi\",\"style\":{\"linkStyle\":\"styled\",\"baseFontSize\":18}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tokenCount").value(1))
            .andExpect(jsonPath("$.source").value("markdown"))
            .andExpect(jsonPath("$.tree.kind").value("container"));

        ArgumentCaptor<RenderStyle> style = ArgumentCaptor.forClass(RenderStyle.class);
        verify(markdownLabelService).renderTokens(any(), any(), style.capture());
        assertEquals(LinkStyle.STYLED, style.getValue().linkStyle());
        assertEquals(18, style.getValue().baseFontSize());
    }

    @Test
    void render_rejectsUnknownStyleValue() throws Exception {
        mvc.perform(post("/api/markdown/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"x\",\"style\":{\"linkStyle\":\"fancy\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value("Unknown linkStyle value: fancy"));
    }

    @Test
    void render_rejectsNullColorComponent() throws Exception {
        mvc.perform(post("/api/markdown/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"x\",\"style\":{\"linkColor\":[1,null,0,1]}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void render_rejectsMalformedBody() throws Exception {
        mvc.perform(post("/api/markdown/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void render_reportsParserFailureAsServerError() throws Exception {
        given(markdownLabelService.parse(any())).willThrow(
            new MarkdownProcessingException("Failed to parse markdown", new IllegalStateException("boom")));

        mvc.perform(post("/api/markdown/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"x\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message", startsWith("Failed to process markdown")))
            .andExpect(jsonPath("$.details", containsString("IllegalStateException: boom")));
    }

    @Test
    void ast_writesTokensAndReferences() throws Exception {
        given(markdownLabelService.parse(HEADING_MARKDOWN)).willReturn(headingDocument());

        mvc.perform(post("/api/markdown/ast")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"# Hi\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tokens[0].type").value("heading"))
            .andExpect(jsonPath("$.tokens[0].attrs.level").value(1))
            .andExpect(jsonPath("$.tokens[0].children[0].raw").value("Hi"))
            .andExpect(jsonPath("$.references[0].url").value("https://docs.test"));
    }

    @Test
    void serialize_readsLooseTokens() throws Exception {
        given(markdownLabelService.toMarkdown(any())).willReturn(HEADING_MARKDOWN);

        mvc.perform(post("/api/markdown/serialize")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokens\":[{\"type\":\"heading\",\"children\":[{\"type\":\"text\",\"raw\":\"Hi\"}]}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.markdown").value(HEADING_MARKDOWN))
            .andExpect(jsonPath("$.tokenCount").value(1));

        ArgumentCaptor<ParsedDocument> document = ArgumentCaptor.forClass(ParsedDocument.class);
        verify(markdownLabelService).toMarkdown(document.capture());
        assertEquals(new MarkdownToken.Heading(1, List.of(new MarkdownToken.Text("Hi"))),
            document.getValue().tokens().get(0));
    }

    @Test
    void serialize_rejectsNonTokenDocument() throws Exception {
        mvc.perform(post("/api/markdown/serialize")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokens\":42}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void renderAst_marksTokenSource() throws Exception {
        given(markdownLabelService.renderTokens(any(), any(), any())).willReturn(emptyTree());

        mvc.perform(post("/api/markdown/render/ast")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokens\":[{\"type\":\"thematic_break\"}],\"references\":{\"a\":\"https://a.test\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("tokens"))
            .andExpect(jsonPath("$.tokenCount").value(1));
    }

    @Test
    void cacheStats_returnsSnapshot() throws Exception {
        given(markdownLabelService.getCacheStats()).willReturn(MarkdownCacheStatsSnapshot.of(3, 1, 0, 2));

        mvc.perform(get("/api/markdown/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hitCount").value(3))
            .andExpect(jsonPath("$.hitRate").value("75.00%"));
    }

    @Test
    void cacheClear_returnsSuccessPayload() throws Exception {
        mvc.perform(post("/api/markdown/cache/clear"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.message").value("Cache cleared successfully"));

        verify(markdownLabelService).clearCache();
    }
}
