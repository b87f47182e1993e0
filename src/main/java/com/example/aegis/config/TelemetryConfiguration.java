package com.example.aegis.config;

import com.example.aegis.service.telemetry.EmbeddingsMetrics;
import com.example.aegis.service.telemetry.MicrometerEmbeddingsMetrics;
import com.example.aegis.service.telemetry.NoopEmbeddingsMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embeddings telemetry: Micrometer when enabled, no-op otherwise.
 */
@Slf4j
@Configuration
public class TelemetryConfiguration {

    @Bean
    public EmbeddingsMetrics embeddingsMetrics(AppProperties appProperties,
                                               ObjectProvider<MeterRegistry> meterRegistry) {
        AppProperties.TelemetryConfig telemetry = appProperties.getTelemetry();
        if (!telemetry.isEnabled()) {
            return new NoopEmbeddingsMetrics();
        }
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.warn("Telemetry enabled but no MeterRegistry is available, metrics disabled");
            return new NoopEmbeddingsMetrics();
        }
        log.info("Embeddings telemetry enabled: attributes={}", telemetry.getAttributes().keySet());
        return new MicrometerEmbeddingsMetrics(registry, telemetry.getAttributes());
    }
}
