package com.architecture.memory.specaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One ordered architectural layer, as declared by a {@code *.layer.json} manifest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Layer {

    private String id;
    private int number;
    private String name;
    private String description;

    // e.g. "ArchiMate 3.2", "NIST SP 800-53"
    private String standardReference;

    // Empty when the manifest does not enumerate its node types
    @Builder.Default
    private List<String> nodeTypeIds = new ArrayList<>();

    @JsonIgnore
    private Path sourceFile;

    public boolean declaresMembership() {
        return nodeTypeIds != null && !nodeTypeIds.isEmpty();
    }
}
