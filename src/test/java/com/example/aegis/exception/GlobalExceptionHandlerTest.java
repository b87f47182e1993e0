package com.example.aegis.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void containerAsyncTimeout_isUpstreamTimeout() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleAsyncTimeout(new AsyncRequestTimeoutException());

        assertEquals(HttpStatus.GATEWAY_TIMEOUT, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals("upstream_timeout", response.getBody().getError().getCode());
        assertEquals("Embedding backend timed out.", response.getBody().getError().getMessage());
    }

    @Test
    void unexpectedException_isInternalWithFixedMessage() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleGeneral(new IllegalStateException("secret detail"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("internal", response.getBody().getError().getCode());
        assertFalse(response.getBody().getError().getMessage().contains("secret"));
    }
}
