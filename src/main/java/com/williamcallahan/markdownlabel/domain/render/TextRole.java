package com.williamcallahan.markdownlabel.domain.render;

/**
 * What a text node displays, so hosts can restyle nodes in place without a rebuild.
 */
public enum TextRole {
    BODY,
    HEADING,
    LIST_MARKER,
    TABLE_HEADER_CELL,
    TABLE_CELL,
    CODE,
    PLACEHOLDER
}
