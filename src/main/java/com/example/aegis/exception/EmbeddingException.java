package com.example.aegis.exception;

import org.springframework.http.HttpStatus;

/**
 * Embedding pipeline failure, carrying one of the canonical error codes.
 * The message is always safe to show to the caller.
 */
public class EmbeddingException extends RuntimeException {

    private final ErrorCode errorCode;

    public EmbeddingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EmbeddingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static EmbeddingException invalidRequest(String message) {
        return new EmbeddingException(ErrorCode.INVALID_REQUEST, message);
    }

    public enum ErrorCode {
        INVALID_REQUEST("invalid_request", HttpStatus.BAD_REQUEST, "Invalid embeddings request."),
        UPSTREAM_ERROR("upstream_error", HttpStatus.SERVICE_UNAVAILABLE, "Embedding backend is unavailable."),
        UPSTREAM_TIMEOUT("upstream_timeout", HttpStatus.GATEWAY_TIMEOUT, "Embedding backend timed out."),
        INTERNAL("internal", HttpStatus.INTERNAL_SERVER_ERROR, "Embedding generation failed.");

        private final String code;
        private final HttpStatus status;
        private final String defaultMessage;

        ErrorCode(String code, HttpStatus status, String defaultMessage) {
            this.code = code;
            this.status = status;
            this.defaultMessage = defaultMessage;
        }

        /** Wire value, also used as the telemetry status attribute */
        public String getCode() {
            return code;
        }

        public HttpStatus getStatus() {
            return status;
        }

        public String getDefaultMessage() {
            return defaultMessage;
        }
    }
}
