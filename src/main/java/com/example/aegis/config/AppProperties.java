package com.example.aegis.config;

import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMax;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application properties, bound once at startup and read-only afterwards.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @NotBlank
    private String serviceName = "aegis-llm-server";

    @NotBlank
    private String serviceVersion = "0.1.0";

    @Valid
    private EmbeddingConfig embedding = new EmbeddingConfig();

    @Valid
    private TelemetryConfig telemetry = new TelemetryConfig();

    @Data
    public static class EmbeddingConfig {
        private boolean enabled = true;

        @NotNull
        private BackendType backend = BackendType.DETERMINISTIC;

        @NotBlank
        private String modelName = "nomic-ai/nomic-embed-text-v1.5";

        /** Extra public aliases accepted on top of the built-in table */
        private List<String> aliases = new ArrayList<>();

        @Min(8)
        @Max(8192)
        private int dimension = 768; // deterministic backend only

        private boolean normalize = true;

        @Min(1)
        @Max(2048)
        private int maxBatchSize = 64;

        @Min(1)
        @Max(1_000_000)
        private int maxInputChars = 32768;

        @Min(1)
        @Max(5_000_000)
        private int maxTotalChars = 262144;

        @NotNull
        @DurationMin(millis = 1)
        @DurationMax(seconds = 600)
        private Duration backendTimeout = Duration.ofSeconds(30);

        @Valid
        private WorkerConfig workers = new WorkerConfig();

        @Valid
        private LocalModelConfig localModel = new LocalModelConfig();

        @Data
        public static class WorkerConfig {
            @Min(1)
            private int poolSize = 4;

            @Min(0)
            private int queueCapacity = 256;
        }

        @Data
        public static class LocalModelConfig {
            // defaults to djl://ai.djl.huggingface.pytorch/<model-name>
            private String modelUrl;

            @NotBlank
            private String engine = "PyTorch";
        }
    }

    @Data
    public static class TelemetryConfig {
        private boolean enabled = false;

        /** Extra tags attached to every embeddings meter */
        private Map<String, String> attributes = new LinkedHashMap<>();
    }

    public enum BackendType {
        DETERMINISTIC("deterministic"),
        LOCAL_MODEL("local-model");

        private final String id;

        BackendType(String id) {
            this.id = id;
        }

        public String getId() {
            return id;
        }
    }
}
