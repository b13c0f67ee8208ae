package com.architecture.memory.specaudit.dto.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two node types of one layer that look semantically redundant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverlapCandidate implements Finding {

    private String layer;
    private String nodeTypeA;
    private String nodeTypeB;
    private double similarityScore;
    private Confidence confidence;
    private int alignmentScore;
    private String reasoning;
    private String suggestion;
    private String standardReference;

    @Override
    public FindingType getFindingType() {
        return FindingType.SEMANTIC_OVERLAP;
    }

    @Override
    public String getSubject() {
        return nodeTypeA + " ~ " + nodeTypeB;
    }
}
