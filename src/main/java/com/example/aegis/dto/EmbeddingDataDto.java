package com.example.aegis.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One embedding item, positioned by {@code index} in input order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingDataDto {
    @Builder.Default
    private String object = "embedding";
    private int index;
    private float[] embedding;
}
