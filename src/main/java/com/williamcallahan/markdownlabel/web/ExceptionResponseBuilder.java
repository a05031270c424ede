package com.williamcallahan.markdownlabel.web;

import com.williamcallahan.markdownlabel.domain.errors.ApiErrorResponse;
import com.williamcallahan.markdownlabel.domain.errors.ApiResponse;
import com.williamcallahan.markdownlabel.domain.errors.ApiSuccessResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the error and success payloads shared by all controllers.
 */
@Component
public class ExceptionResponseBuilder {

    private static final int MAX_CAUSE_DEPTH = 5;

    /**
     * Builds an error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Builds a success response with a simple message.
     *
     * @param message The success message
     * @return ResponseEntity with success details
     */
    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception and its causes as {@code Type: message} segments joined by {@code " <- "}.
     *
     * @param exception exception to describe
     * @return description, or null when no exception is given
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder description = new StringBuilder();
        Throwable current = exception;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            if (depth > 0) {
                description.append(" <- ");
            }
            description.append(current.getClass().getSimpleName());
            if (current.getMessage() != null && !current.getMessage().isBlank()) {
                description.append(": ").append(current.getMessage());
            }
            current = current.getCause() == current ? null : current.getCause();
            depth++;
        }
        return description.toString();
    }
}
