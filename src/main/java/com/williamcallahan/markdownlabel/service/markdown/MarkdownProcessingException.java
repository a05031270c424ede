package com.williamcallahan.markdownlabel.service.markdown;

/**
 * Signals an unexpected failure inside the Markdown parser collaborator.
 */
public class MarkdownProcessingException extends IllegalStateException {

    /**
     * Creates a markdown processing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public MarkdownProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
