package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Definition quality figures of one layer in the node audit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerSummary {
    private String layer;
    private int layerNumber;
    private int nodeTypeCount;
    private double averageQuality;
    private int emptyDescriptions;
    private int genericDescriptions;
    private int undocumentedAttributes;
    private int overlapCount;
    private int completenessIssueCount;
}
