package com.example.aegis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Aegis embedding server
 *
 * - OpenAI-compatible /v1/embeddings endpoint
 * - Deterministic or local-model (DJL) backend, chosen at startup
 * - /health and /v1/models introspection
 */
@SpringBootApplication
public class AegisEmbeddingApplication {

    public static void main(String[] args) {
        SpringApplication.run(AegisEmbeddingApplication.class, args);
    }
}
