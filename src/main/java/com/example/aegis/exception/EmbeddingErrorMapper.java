package com.example.aegis.exception;

import com.example.aegis.exception.EmbeddingException.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies any pipeline failure into the canonical error taxonomy.
 * Backend detail is logged here and never copied into the client message.
 */
@Slf4j
@Component
public class EmbeddingErrorMapper {

    public EmbeddingException classify(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof EmbeddingException) {
            return (EmbeddingException) cause;
        }
        if (cause instanceof TimeoutException) {
            log.warn("Embedding generation timed out");
            return new EmbeddingException(ErrorCode.UPSTREAM_TIMEOUT,
                    ErrorCode.UPSTREAM_TIMEOUT.getDefaultMessage(), cause);
        }
        if (cause instanceof RejectedExecutionException) {
            log.warn("Embedding worker pool saturated: {}", cause.getMessage());
            return new EmbeddingException(ErrorCode.UPSTREAM_ERROR,
                    "Embedding backend is overloaded.", cause);
        }

        log.error("Embedding generation failed", cause);
        return new EmbeddingException(ErrorCode.INTERNAL,
                ErrorCode.INTERNAL.getDefaultMessage(), cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
