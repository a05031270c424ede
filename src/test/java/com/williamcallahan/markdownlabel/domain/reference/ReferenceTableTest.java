package com.williamcallahan.markdownlabel.domain.reference;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceTableTest {

    @Test
    void labelsMatchCaseAndWhitespaceInsensitively() {
        ReferenceTable table = ReferenceTable.of(List.of(new ReferenceDefinition("Java  Docs", "https://j.test", "")));

        ReferenceDefinition definition = table.lookup("  java docs ").orElseThrow();
        assertEquals("https://j.test", definition.url());
        assertFalse(definition.hasTitle());
    }

    @Test
    void firstDefinitionWins() {
        ReferenceTable table = ReferenceTable.of(List.of(
            new ReferenceDefinition("a", "https://first.test", null),
            new ReferenceDefinition("A", "https://second.test", null)));

        assertEquals(1, table.size());
        assertEquals("https://first.test", table.lookup("a").orElseThrow().url());
    }

    @Test
    void blankAndMissingLabelsResolveToNothing() {
        ReferenceTable table = ReferenceTable.of(List.of(new ReferenceDefinition("a", "https://a.test", null)));

        assertTrue(table.lookup("").isEmpty());
        assertTrue(table.lookup(null).isEmpty());
        assertTrue(table.lookup("b").isEmpty());
        assertTrue(ReferenceTable.of(null).isEmpty());
    }
}
