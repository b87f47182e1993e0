package com.example.aegis.service.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed embeddings metrics, tagged by model and status.
 */
public class MicrometerEmbeddingsMetrics implements EmbeddingsMetrics {

    public static final String REQUESTS = "aegis.embeddings.requests";
    public static final String INPUT_TEXTS = "aegis.embeddings.input.texts";
    public static final String DURATION = "aegis.embeddings.duration";
    public static final String PROMPT_TOKENS = "aegis.embeddings.prompt.tokens";

    private final MeterRegistry registry;
    private final Tags commonTags;

    public MicrometerEmbeddingsMetrics(MeterRegistry registry, Map<String, String> attributes) {
        this.registry = registry;
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            tags = tags.and(Tag.of(attribute.getKey(), attribute.getValue()));
        }
        this.commonTags = tags;
    }

    @Override
    public void record(String model, String status, int inputCount, Integer promptTokens, double durationMs) {
        Tags tags = commonTags.and("model", model).and("status", status);

        Counter.builder(REQUESTS)
                .description("Count of /v1/embeddings requests by model and status")
                .tags(tags)
                .register(registry)
                .increment();

        Counter.builder(INPUT_TEXTS)
                .description("Input texts processed by /v1/embeddings")
                .tags(tags)
                .register(registry)
                .increment(Math.max(0, inputCount));

        Timer.builder(DURATION)
                .description("Latency of /v1/embeddings requests")
                .tags(tags)
                .register(registry)
                .record((long) (Math.max(0.0, durationMs) * 1_000_000L), TimeUnit.NANOSECONDS);

        if (promptTokens != null) {
            DistributionSummary.builder(PROMPT_TOKENS)
                    .description("Estimated prompt tokens per /v1/embeddings request")
                    .tags(tags)
                    .register(registry)
                    .record(Math.max(0, promptTokens));
        }
    }
}
