package com.architecture.memory.specaudit.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Limits checked by the CI threshold gate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityThresholds {

    // Relationship audit
    @Builder.Default
    private double maxIsolationPercentage = 20.0;
    @Builder.Default
    private double minDensity = 1.5;
    @Builder.Default
    private int maxHighPriorityGaps = 10;
    @Builder.Default
    private int maxDuplicates = 5;

    // Node audit
    @Builder.Default
    private double minAverageQuality = 70.0;
    @Builder.Default
    private int maxEmptyDescriptionsPerLayer = 5;
    @Builder.Default
    private int maxGenericDescriptionsPerLayer = 10;
    @Builder.Default
    private int maxCompletenessIssues = 0;
    @Builder.Default
    private int maxHighConfidenceOverlaps = 3;

    public static QualityThresholds defaults() {
        return QualityThresholds.builder().build();
    }
}
