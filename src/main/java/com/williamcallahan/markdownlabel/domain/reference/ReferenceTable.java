package com.williamcallahan.markdownlabel.domain.reference;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of link reference definitions keyed by normalized label.
 *
 * <p>Labels match case-insensitively after trimming and collapsing internal
 * whitespace. When a label is defined twice the first definition wins.</p>
 */
public final class ReferenceTable {

    private static final ReferenceTable EMPTY = new ReferenceTable(Map.of());

    private final Map<String, ReferenceDefinition> definitionsByLabel;

    private ReferenceTable(Map<String, ReferenceDefinition> definitionsByLabel) {
        this.definitionsByLabel = definitionsByLabel;
    }

    /**
     * Gets the shared empty table.
     * @return table without definitions
     */
    public static ReferenceTable empty() {
        return EMPTY;
    }

    /**
     * Builds a table from definitions in document order.
     * @param definitions definitions, earlier ones take precedence
     * @return immutable table
     */
    public static ReferenceTable of(Collection<ReferenceDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            return EMPTY;
        }
        Map<String, ReferenceDefinition> byLabel = new LinkedHashMap<>();
        for (ReferenceDefinition definition : definitions) {
            byLabel.putIfAbsent(normalizeLabel(definition.label()), definition);
        }
        return new ReferenceTable(Collections.unmodifiableMap(byLabel));
    }

    /**
     * Normalizes a label for lookup: trimmed, internal whitespace collapsed, lowercased.
     * @param label raw label, may be null
     * @return normalized label, empty for null
     */
    public static String normalizeLabel(String label) {
        if (label == null) {
            return "";
        }
        return label.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a definition by label.
     * @param label label in any case or spacing
     * @return the definition, or empty when undefined or blank
     */
    public Optional<ReferenceDefinition> lookup(String label) {
        String normalized = normalizeLabel(label);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitionsByLabel.get(normalized));
    }

    /**
     * Gets all definitions in document order.
     * @return immutable collection of definitions
     */
    public Collection<ReferenceDefinition> definitions() {
        return definitionsByLabel.values();
    }

    public int size() {
        return definitionsByLabel.size();
    }

    public boolean isEmpty() {
        return definitionsByLabel.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ReferenceTable otherTable
            && definitionsByLabel.equals(otherTable.definitionsByLabel);
    }

    @Override
    public int hashCode() {
        return definitionsByLabel.hashCode();
    }

    @Override
    public String toString() {
        return "ReferenceTable" + definitionsByLabel.values();
    }
}
