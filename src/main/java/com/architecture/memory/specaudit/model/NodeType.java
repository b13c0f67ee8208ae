package com.architecture.memory.specaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A declared kind of element within a layer. The composite id is {@code {layer}.{type}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeType {

    private String specNodeId;
    private String layerId;
    private String type;
    private String title;
    private String description;

    @Builder.Default
    private List<AttributeDefinition> attributes = new ArrayList<>();

    @JsonIgnore
    private Path sourceFile;

    public Optional<AttributeDefinition> findAttribute(String name) {
        if (attributes == null) return Optional.empty();
        return attributes.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    public static String compositeId(String layerId, String type) {
        return layerId + "." + type;
    }
}
