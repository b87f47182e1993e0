package com.example.aegis.controller;

import com.example.aegis.dto.EmbeddingRequestDto;
import com.example.aegis.dto.EmbeddingResponseDto;
import com.example.aegis.service.EmbeddingRequestService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * OpenAI-compatible embeddings endpoint.
 * Returns a Mono so the servlet thread is released while the backend runs.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class EmbeddingController {

    private final EmbeddingRequestService embeddingRequestService;

    @PostMapping(value = "/embeddings", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<EmbeddingResponseDto>> createEmbeddings(
            @RequestBody(required = false) EmbeddingRequestDto request) {
        return embeddingRequestService.createEmbeddings(request)
                .map(ResponseEntity::ok);
    }
}
