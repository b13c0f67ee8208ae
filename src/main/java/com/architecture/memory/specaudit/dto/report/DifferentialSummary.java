package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary statistics for a before/after audit pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DifferentialSummary {
    private int relationshipsAdded;
    private int relationshipsRemoved;
    private int gapsResolved;
    private int newGaps;
    private int persistentGaps;

    // resolved / before, as a percentage
    private double gapResolutionRate;

    private double averageDensityBefore;
    private double averageDensityAfter;
    private double densityImprovement;
    private double averageIsolationBefore;
    private double averageIsolationAfter;

    @Builder.Default
    private List<String> addedRelationships = new ArrayList<>();

    @Builder.Default
    private List<String> resolvedGaps = new ArrayList<>();

    @Builder.Default
    private List<LayerDelta> layerDeltas = new ArrayList<>();

    private DuplicateChanges duplicateChanges;
    private BalanceChanges balanceChanges;
    private ConnectivityComparison connectivityChanges;
}
