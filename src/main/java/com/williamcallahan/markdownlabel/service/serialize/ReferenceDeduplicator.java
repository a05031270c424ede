package com.williamcallahan.markdownlabel.service.serialize;

import com.williamcallahan.markdownlabel.domain.ast.MarkdownToken;
import com.williamcallahan.markdownlabel.domain.reference.ReferenceTable;
import com.williamcallahan.markdownlabel.service.render.ReferenceResolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns one reference label to every URL that links or images use more than once.
 *
 * <p>A URL keeps the label of its first reference-style occurrence when that label is free;
 * otherwise it gets {@code ref-1}, {@code ref-2}, ... in first-occurrence order. Each
 * labelled URL yields exactly one definition line.</p>
 */
final class ReferenceDeduplicator {

    private static final String GENERATED_LABEL_PREFIX = "ref-";

    private final Map<String, String> labelsByUrl;
    private final Map<String, String> titlesByUrl;

    private ReferenceDeduplicator(Map<String, String> labelsByUrl, Map<String, String> titlesByUrl) {
        this.labelsByUrl = labelsByUrl;
        this.titlesByUrl = titlesByUrl;
    }

    static ReferenceDeduplicator collect(List<MarkdownToken> tokens, ReferenceResolver resolver) {
        Map<String, Integer> occurrences = new LinkedHashMap<>();
        Map<String, String> firstLabels = new HashMap<>();
        Map<String, String> firstTitles = new HashMap<>();
        tally(tokens, resolver, occurrences, firstLabels, firstTitles);

        Map<String, String> labelsByUrl = new LinkedHashMap<>();
        Map<String, String> titlesByUrl = new HashMap<>();
        Set<String> usedLabels = new HashSet<>();
        int generated = 0;
        for (Map.Entry<String, Integer> entry : occurrences.entrySet()) {
            if (entry.getValue() < 2) {
                continue;
            }
            String url = entry.getKey();
            String label = firstLabels.get(url);
            if (label != null && (label.indexOf('[') >= 0 || label.indexOf(']') >= 0)) {
                label = null;
            }
            if (label == null || !usedLabels.add(ReferenceTable.normalizeLabel(label))) {
                do {
                    generated++;
                    label = GENERATED_LABEL_PREFIX + generated;
                } while (!usedLabels.add(ReferenceTable.normalizeLabel(label)));
            }
            labelsByUrl.put(url, label);
            if (firstTitles.containsKey(url)) {
                titlesByUrl.put(url, firstTitles.get(url));
            }
        }
        return new ReferenceDeduplicator(labelsByUrl, titlesByUrl);
    }

    /**
     * Gets the label a URL is emitted under.
     * @param url resolved URL
     * @return label when the URL is shared, empty when it is written inline
     */
    Optional<String> labelFor(String url) {
        return Optional.ofNullable(labelsByUrl.get(url));
    }

    /**
     * Formats the definitions in label assignment order.
     * @return lines of the form {@code [label]: url "title"}
     */
    List<String> definitionLines() {
        List<String> lines = new ArrayList<>(labelsByUrl.size());
        for (Map.Entry<String, String> entry : labelsByUrl.entrySet()) {
            String url = entry.getKey();
            StringBuilder line = new StringBuilder()
                .append('[').append(entry.getValue()).append("]: ")
                .append(MarkdownTextEscaper.destination(url));
            String title = titlesByUrl.get(url);
            if (title != null) {
                line.append(' ').append(MarkdownTextEscaper.quoteTitle(title));
            }
            lines.add(line.toString());
        }
        return lines;
    }

    private static void tally(List<MarkdownToken> tokens, ReferenceResolver resolver, Map<String, Integer> occurrences,
                              Map<String, String> firstLabels, Map<String, String> firstTitles) {
        for (MarkdownToken token : tokens) {
            ReferenceResolver.ResolvedTarget target = null;
            if (token instanceof MarkdownToken.Link link) {
                target = resolver.resolve(link);
            } else if (token instanceof MarkdownToken.Image image) {
                target = resolver.resolve(image);
            }
            if (target != null && !target.url().isEmpty()) {
                occurrences.merge(target.url(), 1, Integer::sum);
                if (target.isReference() && !target.referenceLabel().isBlank()) {
                    firstLabels.putIfAbsent(target.url(), target.referenceLabel());
                }
                if (target.title() != null) {
                    firstTitles.putIfAbsent(target.url(), target.title());
                }
            }
            tally(token.children(), resolver, occurrences, firstLabels, firstTitles);
        }
    }
}
