package com.architecture.memory.specaudit.dto.report;

import com.architecture.memory.specaudit.dto.finding.CompletenessIssue;
import com.architecture.memory.specaudit.dto.finding.CoverageMetric;
import com.architecture.memory.specaudit.dto.finding.DuplicateCandidate;
import com.architecture.memory.specaudit.dto.finding.Finding;
import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.model.ModelMetadata;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Relationship-audit report: one canonical object behind every rendering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditReport {

    private ModelMetadata model;
    private Instant timestamp;

    // Set when the audit was scoped to a single layer
    private String layerFilter;

    @Builder.Default
    private List<CoverageMetric> coverage = new ArrayList<>();

    @Builder.Default
    private List<GapCandidate> gaps = new ArrayList<>();

    @Builder.Default
    private List<DuplicateCandidate> duplicates = new ArrayList<>();

    private BalanceReport balance;
    private ConnectivityReport connectivity;

    // Files that failed to parse or link while loading the graph
    @Builder.Default
    private List<CompletenessIssue> completenessIssues = new ArrayList<>();

    @JsonIgnore
    public List<Finding> allFindings() {
        List<Finding> findings = new ArrayList<>();
        findings.addAll(coverage);
        findings.addAll(gaps);
        findings.addAll(duplicates);
        if (balance != null) {
            findings.addAll(balance.getIssues());
        }
        if (connectivity != null) {
            findings.addAll(connectivity.getIssues());
        }
        findings.addAll(completenessIssues);
        return findings;
    }
}
