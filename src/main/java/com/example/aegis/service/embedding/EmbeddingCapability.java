package com.example.aegis.service.embedding;

import com.example.aegis.exception.EmbeddingException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * The process-wide embedding capability: either an initialized backend, disabled by
 * configuration, or failed during startup. Built once; a failed backend is never reloaded.
 */
@Slf4j
public final class EmbeddingCapability implements AutoCloseable {

    private static final String NO_BACKEND = "none";

    private final boolean enabled;
    private final EmbeddingBackend backend;
    private final String failureReason;

    private EmbeddingCapability(boolean enabled, EmbeddingBackend backend, String failureReason) {
        this.enabled = enabled;
        this.backend = backend;
        this.failureReason = failureReason;
    }

    public static EmbeddingCapability ready(EmbeddingBackend backend) {
        return new EmbeddingCapability(true, backend, null);
    }

    public static EmbeddingCapability disabled() {
        return new EmbeddingCapability(false, null, "Embeddings are disabled.");
    }

    public static EmbeddingCapability failed(String reason) {
        return new EmbeddingCapability(true, null, reason);
    }

    /**
     * Whether configuration enables embeddings (regardless of backend state)
     */
    public boolean isEnabled() {
        return enabled;
    }

    public boolean isAvailable() {
        return enabled && backend != null;
    }

    public Optional<EmbeddingBackend> getBackend() {
        return Optional.ofNullable(backend);
    }

    public String getBackendName() {
        return backend != null ? backend.getName() : NO_BACKEND;
    }

    /**
     * Internal description of why the backend is unavailable; never sent to callers
     */
    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * Return the backend or fail fast with {@code upstream_error}.
     */
    public EmbeddingBackend require() {
        if (!enabled) {
            throw new EmbeddingException(EmbeddingException.ErrorCode.UPSTREAM_ERROR, "Embeddings are disabled.");
        }
        if (backend == null) {
            throw new EmbeddingException(EmbeddingException.ErrorCode.UPSTREAM_ERROR,
                    EmbeddingException.ErrorCode.UPSTREAM_ERROR.getDefaultMessage());
        }
        return backend;
    }

    @Override
    public void close() {
        if (backend == null) {
            return;
        }
        try {
            backend.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close embedding backend {}: {}", backend.getName(), e.getMessage());
        }
    }
}
