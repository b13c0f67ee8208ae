package com.architecture.memory.specaudit.dto.report;

import com.architecture.memory.specaudit.dto.finding.ConnectivityIssue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole-graph connectivity across all layers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectivityReport {

    private ConnectivityStats stats;

    // Weakly connected components, largest first; members sorted
    @Builder.Default
    private List<List<String>> components = new ArrayList<>();

    @Builder.Default
    private List<String> isolatedNodeTypes = new ArrayList<>();

    // e.g. ["a.x", "transitive-predicate", "a.y", "a.z"]
    @Builder.Default
    private List<List<String>> transitiveChains = new ArrayList<>();

    @Builder.Default
    private List<ConnectivityIssue> issues = new ArrayList<>();
}
