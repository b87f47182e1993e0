package com.example.aegis.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelListDto {
    private String object = "list";
    private List<ModelDto> data;

    public ModelListDto(List<ModelDto> data) {
        this.data = data;
    }
}
