package com.williamcallahan.markdownlabel.service.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class MarkupEscaperTest {

    @Test
    @DisplayName("Brackets and ampersands become entities")
    void escapesMarkupControlCharacters() {
        assertEquals("&bl;b&br;bold&bl;/b&br; &amp; more", MarkupEscaper.escape("[b]bold[/b] & more"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "plain", "[", "]]", "&", "&bl;", "&amp;br;", "a[&]b", "[ref=x][/ref]", "&&[[]]&"})
    @DisplayName("Unescape inverts escape")
    void unescapeInvertsEscape(String text) {
        assertEquals(text, MarkupEscaper.unescape(MarkupEscaper.escape(text)));
    }

    @Test
    @DisplayName("No raw control characters survive escaping")
    void escapedTextHasNoRawBrackets() {
        String escaped = MarkupEscaper.escape("[]&[&]]&");
        String withoutEntities = escaped.replace("&amp;", "").replace("&bl;", "").replace("&br;", "");
        assertFalse(withoutEntities.contains("["));
        assertFalse(withoutEntities.contains("]"));
        assertFalse(withoutEntities.contains("&"));
    }

    @Test
    @DisplayName("URL brackets are percent-encoded")
    void escapesUrlBrackets() {
        assertEquals("https://x.test/%5B/ref%5D%5Bb%5D", MarkupEscaper.escapeUrl("https://x.test/[/ref][b]"));
    }

    @Test
    @DisplayName("HTML delimiters are entity-escaped but ampersands are kept")
    void escapesHtmlWithoutAmpersand() {
        assertEquals("&lt;a href=&quot;x&quot; title=&#x27;t&#x27;&gt;&", MarkupEscaper.escapeHtml("<a href=\"x\" title='t'>&"));
    }

    @Test
    void nullInputsYieldEmptyStrings() {
        assertEquals("", MarkupEscaper.escape(null));
        assertEquals("", MarkupEscaper.unescape(null));
        assertEquals("", MarkupEscaper.escapeUrl(null));
        assertEquals("", MarkupEscaper.escapeHtml(null));
    }
}
