package com.williamcallahan.markdownlabel.service.markdown;

/**
 * Signals that a loose JSON token document does not have the token shape.
 */
public class TokenFormatException extends IllegalArgumentException {

    public TokenFormatException(String message) {
        super(message);
    }

    public TokenFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
