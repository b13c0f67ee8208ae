package com.architecture.memory.specaudit.dto.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-layer coverage metrics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverageMetric implements Finding {

    private String layer;
    private int layerNumber;
    private int nodeTypeCount;
    private int intraLayerRelationships;
    private int interLayerRelationships;

    // Relationships whose source node type belongs to this layer
    private int relationshipCount;

    @Builder.Default
    private List<String> isolatedNodeTypes = new ArrayList<>();

    private double isolationPercentage;
    private double relationshipsPerNodeType;

    @Builder.Default
    private List<String> usedPredicates = new ArrayList<>();

    private double utilizationPercentage;
    private int alignmentScore;
    private String reasoning;
    private String standardReference;

    @Override
    public FindingType getFindingType() {
        return FindingType.COVERAGE_METRIC;
    }

    @Override
    public String getSubject() {
        return layer;
    }

    @Override
    public String getSuggestion() {
        if (isolatedNodeTypes == null || isolatedNodeTypes.isEmpty()) {
            return "No action required for layer " + layer;
        }
        return "Create relationship types for isolated node types: " + String.join(", ", isolatedNodeTypes);
    }
}
