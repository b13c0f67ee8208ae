package com.architecture.memory.specaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetadata {

    private String name;
    private String version;

    public static ModelMetadata defaults() {
        return new ModelMetadata("Architecture Specification", "1.0.0");
    }
}
