package com.example.aegis.service.telemetry;

/**
 * Observer for completed embeddings requests. Called once per request after the outcome
 * is known; implementations must be cheap.
 */
public interface EmbeddingsMetrics {

    /**
     * @param model        resolved backend model, or the requested identifier if resolution did not happen
     * @param status       {@code ok} or a canonical error code
     * @param inputCount   number of input texts, 0 if the input could not be read
     * @param promptTokens estimated prompt tokens, {@code null} if not computed
     * @param durationMs   wall-clock time spent in the pipeline
     */
    void record(String model, String status, int inputCount, Integer promptTokens, double durationMs);
}
