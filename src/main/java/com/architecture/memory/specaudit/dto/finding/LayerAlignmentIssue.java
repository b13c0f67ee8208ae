package com.architecture.memory.specaudit.dto.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node type whose relationships all point into one other layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerAlignmentIssue implements Finding {

    private String nodeType;
    private String currentLayer;
    private String suggestedLayer;
    private int intraLayerEdges;
    private int crossLayerEdges;
    private int alignmentScore;
    private String reasoning;
    private String standardReference;

    @Override
    public FindingType getFindingType() {
        return FindingType.LAYER_ALIGNMENT;
    }

    @Override
    public String getSubject() {
        return nodeType;
    }

    @Override
    public String getSuggestion() {
        return "Move node type " + nodeType + " to layer " + suggestedLayer;
    }
}
