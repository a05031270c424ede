package com.williamcallahan.markdownlabel.domain.reference;

import java.util.Objects;

/**
 * A link reference definition such as {@code [label]: https://example.com "Title"}.
 *
 * @param label label as written in the source
 * @param url destination URL
 * @param title optional title, null when absent
 */
public record ReferenceDefinition(String label, String url, String title) {

    public ReferenceDefinition {
        Objects.requireNonNull(label, "Reference label cannot be null");
        url = url == null ? "" : url;
        if (title != null && title.isEmpty()) {
            title = null;
        }
    }

    /**
     * Checks whether this definition carries a title.
     * @return true when a non-empty title is present
     */
    public boolean hasTitle() {
        return title != null;
    }
}
