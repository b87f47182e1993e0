package com.example.aegis.exception;

import com.example.aegis.exception.EmbeddingException.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

/**
 * Renders every failure as the canonical {@code {"error": {...}}} envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<ErrorResponse> handleEmbedding(EmbeddingException e) {
        ErrorCode code = e.getErrorCode();
        if (code == ErrorCode.INVALID_REQUEST) {
            log.debug("Rejected embeddings request: {}", e.getMessage());
        }
        return toResponse(code, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return toResponse(ErrorCode.INVALID_REQUEST, "Request body must be a valid JSON object.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException e) {
        return toResponse(ErrorCode.INVALID_REQUEST, "Content-Type must be application/json.");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException e) {
        return toResponse(HttpStatus.METHOD_NOT_ALLOWED, ErrorCode.INVALID_REQUEST,
                "Method " + e.getMethod() + " is not supported for this endpoint.");
    }

    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleAsyncTimeout(AsyncRequestTimeoutException e) {
        log.warn("Servlet container timed out an embeddings request before the backend deadline");
        return toResponse(ErrorCode.UPSTREAM_TIMEOUT, ErrorCode.UPSTREAM_TIMEOUT.getDefaultMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception e) {
        log.error("Unhandled exception", e);
        return toResponse(ErrorCode.INTERNAL, ErrorCode.INTERNAL.getDefaultMessage());
    }

    private static ResponseEntity<ErrorResponse> toResponse(ErrorCode code, String message) {
        return toResponse(code.getStatus(), code, message);
    }

    private static ResponseEntity<ErrorResponse> toResponse(HttpStatus status, ErrorCode code, String message) {
        String safeMessage = message != null ? message : code.getDefaultMessage();
        return ResponseEntity.status(status)
                .body(new ErrorResponse(new ErrorPayload(code.getCode(), safeMessage)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private ErrorPayload error;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorPayload {
        private String code;
        private String message;
    }
}
