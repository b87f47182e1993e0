package com.example.aegis.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Duration;

/**
 * Keeps the servlet async timeout above the backend deadline, so a slow backend is
 * always reported by the deadline supervisor rather than by the container.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebConfiguration implements WebMvcConfigurer {

    static final Duration ASYNC_TIMEOUT_MARGIN = Duration.ofSeconds(5);

    private final AppProperties appProperties;

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        long timeoutMs = asyncRequestTimeout().toMillis();
        log.debug("Async request timeout set to {} ms", timeoutMs);
        configurer.setDefaultTimeout(timeoutMs);
    }

    Duration asyncRequestTimeout() {
        return appProperties.getEmbedding().getBackendTimeout().plus(ASYNC_TIMEOUT_MARGIN);
    }
}
