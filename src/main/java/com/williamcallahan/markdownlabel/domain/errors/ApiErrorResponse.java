package com.williamcallahan.markdownlabel.domain.errors;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Error payload for failed requests.
 *
 * @param status always {@code "error"}
 * @param message client-facing error message
 * @param details exception detail, omitted when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
