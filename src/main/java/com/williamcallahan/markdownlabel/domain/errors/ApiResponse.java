package com.williamcallahan.markdownlabel.domain.errors;

/**
 * Shared contract for the status payloads returned by the REST surface.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return {@code "error"} or {@code "success"}
     */
    String status();
}
