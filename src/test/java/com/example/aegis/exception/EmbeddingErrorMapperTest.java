package com.example.aegis.exception;

import com.example.aegis.exception.EmbeddingException.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingErrorMapperTest {

    private final EmbeddingErrorMapper mapper = new EmbeddingErrorMapper();

    @Test
    void classifiedFailures_passThrough() {
        EmbeddingException original = EmbeddingException.invalidRequest("bad");
        assertSame(original, mapper.classify(original));
        assertSame(original, mapper.classify(new CompletionException(original)));
    }

    @Test
    void timeout_isUpstreamTimeout() {
        EmbeddingException e = mapper.classify(new TimeoutException("slow"));
        assertEquals(ErrorCode.UPSTREAM_TIMEOUT, e.getErrorCode());
        assertEquals(HttpStatus.GATEWAY_TIMEOUT, e.getErrorCode().getStatus());
    }

    @Test
    void rejectedWork_isUpstreamError() {
        EmbeddingException e = mapper.classify(new TaskRejectedException("queue full"));
        assertEquals(ErrorCode.UPSTREAM_ERROR, e.getErrorCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode().getStatus());
    }

    @Test
    void anythingElse_isInternal_withFixedMessage() {
        EmbeddingException e = mapper.classify(
                new ExecutionException(new IllegalArgumentException("tensor shape [1, 3] secret")));
        assertEquals(ErrorCode.INTERNAL, e.getErrorCode());
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode().getStatus());
        assertEquals(ErrorCode.INTERNAL.getDefaultMessage(), e.getMessage());
        assertTrue(e.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void wireCodes_matchTaxonomy() {
        assertEquals("invalid_request", ErrorCode.INVALID_REQUEST.getCode());
        assertEquals("upstream_error", ErrorCode.UPSTREAM_ERROR.getCode());
        assertEquals("upstream_timeout", ErrorCode.UPSTREAM_TIMEOUT.getCode());
        assertEquals("internal", ErrorCode.INTERNAL.getCode());
        assertEquals(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_REQUEST.getStatus());
    }
}
