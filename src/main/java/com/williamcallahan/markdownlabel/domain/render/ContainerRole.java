package com.williamcallahan.markdownlabel.domain.render;

/**
 * Which block construct a container was built for.
 */
public enum ContainerRole {
    DOCUMENT,
    LIST,
    LIST_ITEM,
    LIST_ITEM_CONTENT,
    CODE_BLOCK,
    BLOCK_QUOTE
}
