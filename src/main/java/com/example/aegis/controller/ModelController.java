package com.example.aegis.controller;

import com.example.aegis.config.AppProperties;
import com.example.aegis.dto.ModelDto;
import com.example.aegis.dto.ModelListDto;
import com.example.aegis.service.ModelAliasResolver;
import com.example.aegis.service.embedding.EmbeddingCapability;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists advertised embedding model aliases
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ModelController {

    private final EmbeddingCapability capability;
    private final ModelAliasResolver aliasResolver;
    private final AppProperties appProperties;

    @GetMapping("/models")
    public ResponseEntity<ModelListDto> list() {
        if (!capability.isAvailable()) {
            return ResponseEntity.ok(new ModelListDto(Collections.emptyList()));
        }

        long created = Instant.now().getEpochSecond();
        List<ModelDto> models = aliasResolver.advertisedModels().stream()
                .map(id -> ModelDto.builder()
                        .id(id)
                        .created(created)
                        .ownedBy(appProperties.getServiceName())
                        .build())
                .collect(Collectors.toList());
        return ResponseEntity.ok(new ModelListDto(models));
    }
}
