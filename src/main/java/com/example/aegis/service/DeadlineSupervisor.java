package com.example.aegis.service;

import com.example.aegis.config.AppProperties;
import com.example.aegis.config.EmbeddingBackendConfiguration;
import com.example.aegis.exception.EmbeddingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Runs backend calls on the embedding worker pool and bounds how long the caller waits.
 *
 * <p>On overrun the caller gets {@code upstream_timeout}. The worker is not interrupted:
 * the backend call may keep running until it finishes on its own.
 */
@Slf4j
@Component
public class DeadlineSupervisor {

    private final Executor executor;
    private final Duration timeout;

    @Autowired
    public DeadlineSupervisor(@Qualifier(EmbeddingBackendConfiguration.EMBEDDING_EXECUTOR) Executor executor,
                              AppProperties appProperties) {
        this(executor, appProperties.getEmbedding().getBackendTimeout());
    }

    public DeadlineSupervisor(Executor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public <T> Mono<T> supervise(Callable<T> call) {
        return Mono.defer(() -> Mono.fromFuture(submit(call)))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> {
                    log.warn("Embedding backend call exceeded deadline of {} ms", timeout.toMillis());
                    return new EmbeddingException(EmbeddingException.ErrorCode.UPSTREAM_TIMEOUT,
                            EmbeddingException.ErrorCode.UPSTREAM_TIMEOUT.getDefaultMessage(), e);
                });
    }

    private <T> CompletableFuture<T> submit(Callable<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
