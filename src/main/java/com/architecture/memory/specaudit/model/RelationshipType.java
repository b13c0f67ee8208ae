package com.architecture.memory.specaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * A declared, directed, typed edge between two node types.
 * The composite id is {@code {sourceLayer}.{sourceType}.{predicate}.{destLayer}.{destType}}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipType {

    private String id;
    private String sourceSpecNodeId;
    private String sourceLayer;
    private String destinationSpecNodeId;
    private String destinationLayer;
    private String predicate;

    @Builder.Default
    private Cardinality cardinality = Cardinality.MANY_TO_MANY;

    @Builder.Default
    private Strength strength = Strength.MEDIUM;

    @JsonIgnore
    private Path sourceFile;

    /**
     * Key used for the no-repeated-predicate invariant and for gap deduplication.
     */
    @JsonIgnore
    public String tripleKey() {
        return tripleKey(sourceSpecNodeId, predicate, destinationSpecNodeId);
    }

    @JsonIgnore
    public boolean isIntraLayer() {
        return sourceLayer != null && sourceLayer.equals(destinationLayer);
    }

    public static String tripleKey(String source, String predicate, String destination) {
        return source + "|" + predicate + "|" + destination;
    }

    public static String compositeId(String sourceSpecNodeId, String predicate, String destinationSpecNodeId) {
        return sourceSpecNodeId + "." + predicate + "." + destinationSpecNodeId;
    }
}
