package com.architecture.memory.specaudit.dto.report;

import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one pipeline run. {@code after} and {@code differential} are only present when
 * the external step completed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResult {

    public enum ExternalStatus {
        DISABLED,
        COMPLETED,
        UNAVAILABLE,
        ABORTED
    }

    private AuditReport before;
    private AuditReport after;
    private DifferentialSummary differential;

    @Builder.Default
    private ExternalStatus externalStatus = ExternalStatus.DISABLED;

    private String statusMessage;
    private int requestsSent;
    private int failedRequests;

    @Builder.Default
    private List<RecommendationRecord> recommendations = new ArrayList<>();

    // Detected gaps plus accepted external recommendations
    @Builder.Default
    private List<GapCandidate> mergedGaps = new ArrayList<>();

    @JsonIgnore
    public boolean hasAfter() {
        return after != null;
    }

    /**
     * The report handed to resolution: the baseline findings with the merged gap list when
     * the external step completed, the baseline alone otherwise.
     */
    @JsonIgnore
    public AuditReport publishedReport() {
        if (externalStatus != ExternalStatus.COMPLETED) {
            return before;
        }
        return AuditReport.builder()
                .model(before.getModel())
                .timestamp(before.getTimestamp())
                .layerFilter(before.getLayerFilter())
                .coverage(before.getCoverage())
                .gaps(mergedGaps)
                .duplicates(before.getDuplicates())
                .balance(before.getBalance())
                .connectivity(before.getConnectivity())
                .completenessIssues(before.getCompletenessIssues())
                .build();
    }
}
