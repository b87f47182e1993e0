package com.example.aegis.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OpenAI-compatible embeddings request.
 * {@code input} is kept as raw JSON: a string or an array of strings is accepted,
 * anything else is rejected during validation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingRequestDto {
    private String model;

    private JsonNode input;

    @JsonProperty("encoding_format")
    private String encodingFormat;
}
