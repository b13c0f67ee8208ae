package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Distribution of relationship counts per node type within one layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerBalance {
    private String layer;
    private int nodeTypeCount;
    private int minRelationships;
    private double medianRelationships;
    private int maxRelationships;

    // nodeType -> incident relationship count
    @Builder.Default
    private Map<String, Integer> relationshipCounts = new TreeMap<>();
}
