package com.example.aegis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Service health and embedding backend readiness
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthDto {
    private String status; // ok | error
    private String service;
    private String version;
    private String backend;
    @JsonProperty("embedding_enabled")
    private boolean embeddingEnabled;
}
