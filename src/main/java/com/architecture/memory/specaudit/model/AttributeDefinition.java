package com.architecture.memory.specaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttributeDefinition {
    private String name;
    private String type;          // string, integer, boolean, array, object, ...
    private String format;        // uri, date-time, ...
    private boolean required;
    private String description;

    @Builder.Default
    private List<String> enumValues = new ArrayList<>();

    public boolean isDocumented() {
        return description != null && !description.isBlank();
    }
}
