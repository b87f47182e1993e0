package com.example.aegis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Model item for /v1/models
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelDto {
    private String id;
    @Builder.Default
    private String object = "model";
    private long created;
    @JsonProperty("owned_by")
    private String ownedBy;
}
