package com.architecture.memory.specaudit.dto.report;

import com.architecture.memory.specaudit.dto.finding.*;
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
 * Node-audit report: definition quality, overlaps, completeness and layer alignment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeAuditReport {

    private ModelMetadata model;
    private Instant timestamp;
    private String layerFilter;

    @Builder.Default
    private List<LayerSummary> layerSummaries = new ArrayList<>();

    @Builder.Default
    private List<DefinitionQualityFinding> definitionQuality = new ArrayList<>();

    @Builder.Default
    private List<OverlapCandidate> overlaps = new ArrayList<>();

    @Builder.Default
    private List<CompletenessIssue> completenessIssues = new ArrayList<>();

    @Builder.Default
    private List<LayerAlignmentIssue> layerAlignment = new ArrayList<>();

    @JsonIgnore
    public List<Finding> allFindings() {
        List<Finding> findings = new ArrayList<>();
        findings.addAll(definitionQuality);
        findings.addAll(overlaps);
        findings.addAll(completenessIssues);
        findings.addAll(layerAlignment);
        return findings;
    }
}
