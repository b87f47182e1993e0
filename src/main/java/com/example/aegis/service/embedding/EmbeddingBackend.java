package com.example.aegis.service.embedding;

import java.util.List;

/**
 * Embedding backend
 */
public interface EmbeddingBackend extends AutoCloseable {

    /**
     * Backend identifier reported by /health
     */
    String getName();

    /**
     * Model identifier every accepted alias resolves to
     */
    String getModelName();

    /**
     * Vector dimension, identical for every vector this instance returns
     */
    int getDimension();

    /**
     * Embed a batch of texts. The result has the same size and order as {@code texts}.
     * May block; callers run it off the request thread.
     */
    List<float[]> embedBatch(List<String> texts) throws Exception;

    @Override
    default void close() {
    }
}
