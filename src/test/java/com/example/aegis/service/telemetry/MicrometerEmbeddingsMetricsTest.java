package com.example.aegis.service.telemetry;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerEmbeddingsMetricsTest {

    @Test
    void record_updatesMetersTaggedByModelAndStatus() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        var metrics = new MicrometerEmbeddingsMetrics(registry, Collections.singletonMap("deployment", "test"));

        metrics.record("nomic", "ok", 3, 7, 12.5);
        metrics.record("nomic", "ok", 2, 1, 7.5);
        metrics.record("nomic", "invalid_request", 0, null, 1.0);

        assertEquals(2.0, registry.get(MicrometerEmbeddingsMetrics.REQUESTS)
                .tags("model", "nomic", "status", "ok", "deployment", "test").counter().count());
        assertEquals(1.0, registry.get(MicrometerEmbeddingsMetrics.REQUESTS)
                .tags("status", "invalid_request").counter().count());
        assertEquals(5.0, registry.get(MicrometerEmbeddingsMetrics.INPUT_TEXTS)
                .tags("status", "ok").counter().count());

        Timer timer = registry.get(MicrometerEmbeddingsMetrics.DURATION).tags("status", "ok").timer();
        assertEquals(2, timer.count());
        assertEquals(20.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.01);

        DistributionSummary tokens = registry.get(MicrometerEmbeddingsMetrics.PROMPT_TOKENS)
                .tags("status", "ok").summary();
        assertEquals(8.0, tokens.totalAmount());
        assertNull(registry.find(MicrometerEmbeddingsMetrics.PROMPT_TOKENS)
                .tags("status", "invalid_request").summary());
    }

    @Test
    void noop_acceptsAnything() {
        assertDoesNotThrow(() -> new NoopEmbeddingsMetrics().record("m", "ok", 1, null, 0.0));
    }
}
