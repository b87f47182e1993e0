package com.example.aegis.service.telemetry;

/**
 * Used when telemetry is disabled.
 */
public class NoopEmbeddingsMetrics implements EmbeddingsMetrics {

    @Override
    public void record(String model, String status, int inputCount, Integer promptTokens, double durationMs) {
    }
}
