package com.example.aegis.config;

import com.example.aegis.service.embedding.DeterministicEmbeddingBackend;
import com.example.aegis.service.embedding.EmbeddingBackend;
import com.example.aegis.service.embedding.EmbeddingCapability;
import com.example.aegis.service.embedding.LocalModelEmbeddingBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Builds the embedding backend once at startup, and the worker pool that runs it.
 */
@Slf4j
@Configuration
public class EmbeddingBackendConfiguration {

    public static final String EMBEDDING_EXECUTOR = "embeddingExecutor";

    @Bean
    public EmbeddingCapability embeddingCapability(AppProperties appProperties) {
        AppProperties.EmbeddingConfig config = appProperties.getEmbedding();
        if (!config.isEnabled()) {
            log.info("Embeddings disabled by configuration");
            return EmbeddingCapability.disabled();
        }

        log.info("Configuring embedding backend: type={}, model={}",
                config.getBackend().getId(), config.getModelName());
        try {
            return EmbeddingCapability.ready(createBackend(config));
        } catch (Exception e) {
            // capability stays unavailable for the process lifetime
            log.error("Embedding backend '{}' failed to initialize", config.getBackend().getId(), e);
            return EmbeddingCapability.failed("Backend initialization failed: " + e.getClass().getSimpleName());
        }
    }

    @Bean(name = EMBEDDING_EXECUTOR)
    public ThreadPoolTaskExecutor embeddingExecutor(AppProperties appProperties) {
        AppProperties.EmbeddingConfig.WorkerConfig workers = appProperties.getEmbedding().getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers.getPoolSize());
        executor.setMaxPoolSize(workers.getPoolSize());
        executor.setQueueCapacity(workers.getQueueCapacity());
        executor.setThreadNamePrefix("embedding-");
        executor.setDaemon(true);
        // timed-out work is left to finish; do not hold shutdown for it
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    static EmbeddingBackend createBackend(AppProperties.EmbeddingConfig config) throws Exception {
        switch (config.getBackend()) {
            case LOCAL_MODEL:
                return LocalModelEmbeddingBackend.load(config);
            case DETERMINISTIC:
            default:
                return new DeterministicEmbeddingBackend(
                        config.getModelName(), config.getDimension(), config.isNormalize());
        }
    }
}
