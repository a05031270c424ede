package com.williamcallahan.markdownlabel.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.markdownlabel.domain.errors.ApiErrorResponse;
import com.williamcallahan.markdownlabel.domain.errors.ApiResponse;
import com.williamcallahan.markdownlabel.domain.errors.ApiSuccessResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies exception descriptions and response payload shapes.
 */
class ExceptionResponseBuilderTest {
    private static final String ROOT_MESSAGE = "bad token";
    private static final String WRAPPER_MESSAGE = "Failed to parse markdown";

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_joinsCauseChain() {
        IllegalStateException exception = new IllegalStateException(WRAPPER_MESSAGE,
            new IllegalArgumentException(ROOT_MESSAGE));

        String details = builder.describeException(exception);

        assertEquals("IllegalStateException: Failed to parse markdown <- IllegalArgumentException: bad token", details);
    }

    @Test
    void describeException_stopsAfterFiveCauses() {
        Exception chain = new RuntimeException("0");
        for (int level = 1; level <= 7; level++) {
            chain = new RuntimeException(Integer.toString(level), chain);
        }

        String details = builder.describeException(chain);

        assertEquals(5, details.split(" <- ").length);
    }

    @Test
    void describeException_omitsBlankMessagesAndNull() {
        assertEquals("NullPointerException", builder.describeException(new NullPointerException()));
        assertNull(builder.describeException(null));
    }

    @Test
    void buildErrorResponse_carriesStatusAndDetails() {
        ResponseEntity<ApiResponse> response = builder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
            WRAPPER_MESSAGE, new IllegalStateException(ROOT_MESSAGE));

        assertEquals(500, response.getStatusCode().value());
        ApiErrorResponse body = assertInstanceOf(ApiErrorResponse.class, response.getBody());
        assertEquals("error", body.status());
        assertEquals("IllegalStateException: bad token", body.details());
    }

    @Test
    void buildSuccessResponse_returnsOk() {
        ResponseEntity<ApiResponse> response = builder.buildSuccessResponse("done");

        assertEquals(200, response.getStatusCode().value());
        ApiSuccessResponse body = assertInstanceOf(ApiSuccessResponse.class, response.getBody());
        assertEquals("success", body.status());
        assertEquals("done", body.message());
    }
}
