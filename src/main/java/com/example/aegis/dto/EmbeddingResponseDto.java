package com.example.aegis.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible embeddings response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingResponseDto {
    @Builder.Default
    private String object = "list";
    private List<EmbeddingDataDto> data;
    private String model; // alias the caller asked for
    private UsageDto usage;
}
