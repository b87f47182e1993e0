package com.example.aegis.service.embedding;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Stable hash-based embeddings with a fixed dimension, for testing and control.
 * Stateless; safe for concurrent use.
 */
@Slf4j
public class DeterministicEmbeddingBackend implements EmbeddingBackend {

    public static final String NAME = "deterministic";

    private static final double SCALE = 2147483648.0; // 2^31

    private final String modelName;
    private final int dimension;
    private final boolean normalize;

    public DeterministicEmbeddingBackend(String modelName, int dimension, boolean normalize) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.modelName = modelName;
        this.dimension = dimension;
        this.normalize = normalize;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (String text : texts) {
            embeddings.add(embed(text));
        }
        return embeddings;
    }

    public float[] embed(String text) {
        float[] embedding = new float[dimension];
        if (text == null || text.isEmpty()) {
            return embedding;
        }

        MessageDigest digest = sha256();
        for (int i = 0; i < dimension; i++) {
            byte[] hash = digest.digest((text + ":" + i).getBytes(StandardCharsets.UTF_8));
            long raw = ((hash[0] & 0xFFL) << 24)
                    | ((hash[1] & 0xFFL) << 16)
                    | ((hash[2] & 0xFFL) << 8)
                    | (hash[3] & 0xFFL);
            embedding[i] = (float) (raw / SCALE - 1.0);
        }

        if (normalize) {
            normalize(embedding);
        }
        log.trace("Deterministic embedding: chars={}, dimension={}", text.length(), dimension);
        return embedding;
    }

    private static void normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);
        if (norm <= 0) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
