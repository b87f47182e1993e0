package com.example.aegis.controller;

import com.example.aegis.config.AppProperties;
import com.example.aegis.dto.HealthDto;
import com.example.aegis.service.embedding.EmbeddingCapability;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service health and embedding backend readiness.
 * Always 200; {@code status} carries the verdict.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final EmbeddingCapability capability;
    private final AppProperties appProperties;

    @GetMapping("/health")
    public ResponseEntity<HealthDto> health() {
        return ResponseEntity.ok(HealthDto.builder()
                .status(capability.isAvailable() ? "ok" : "error")
                .service(appProperties.getServiceName())
                .version(appProperties.getServiceVersion())
                .backend(capability.getBackendName())
                .embeddingEnabled(capability.isEnabled())
                .build());
    }
}
