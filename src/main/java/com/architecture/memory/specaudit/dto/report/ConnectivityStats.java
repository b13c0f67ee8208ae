package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectivityStats {
    private int nodeTypeCount;
    private int relationshipCount;
    private int componentCount;
    private int largestComponentSize;
    private int isolatedCount;
    private double averageDegree;
    private int transitiveChainCount;

    // Share of cross-layer relationships flowing from a higher to a lower (or equal) layer number
    private double layerCompliancePercentage;
}
