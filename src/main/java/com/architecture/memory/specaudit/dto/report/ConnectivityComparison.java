package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectivityComparison {
    private int componentsBefore;
    private int componentsAfter;
    private int isolatedBefore;
    private int isolatedAfter;
    private double averageDegreeBefore;
    private double averageDegreeAfter;

    // negative means more connected
    private int componentChange;
    // negative means fewer isolated node types
    private int isolationChange;
    private double degreeChange;
}
