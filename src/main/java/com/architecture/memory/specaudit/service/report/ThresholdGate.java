package com.architecture.memory.specaudit.service.report;

import com.architecture.memory.specaudit.config.QualityThresholds;
import com.architecture.memory.specaudit.dto.finding.Confidence;
import com.architecture.memory.specaudit.dto.finding.CoverageMetric;
import com.architecture.memory.specaudit.dto.finding.Priority;
import com.architecture.memory.specaudit.dto.report.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CI gate: maps report metrics onto pass/fail against the configured thresholds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThresholdGate {

    private final QualityThresholds thresholds;

    public ThresholdCheckResult check(AuditReport report) {
        List<String> violations = new ArrayList<>();
        for (CoverageMetric coverage : report.getCoverage()) {
            if (coverage.getIsolationPercentage() > thresholds.getMaxIsolationPercentage()) {
                violations.add(String.format(Locale.ROOT, "Layer %s: isolation %.1f%% exceeds threshold %.1f%%",
                        coverage.getLayer(), coverage.getIsolationPercentage(), thresholds.getMaxIsolationPercentage()));
            }
            if (coverage.getRelationshipsPerNodeType() < thresholds.getMinDensity()) {
                violations.add(String.format(Locale.ROOT, "Layer %s: density %.2f below threshold %.2f",
                        coverage.getLayer(), coverage.getRelationshipsPerNodeType(), thresholds.getMinDensity()));
            }
        }

        long highPriorityGaps = report.getGaps().stream().filter(g -> g.getPriority() == Priority.HIGH).count();
        if (highPriorityGaps > thresholds.getMaxHighPriorityGaps()) {
            violations.add("High-priority gaps: " + highPriorityGaps + " exceeds threshold "
                    + thresholds.getMaxHighPriorityGaps());
        }
        if (report.getDuplicates().size() > thresholds.getMaxDuplicates()) {
            violations.add("Duplicate candidates: " + report.getDuplicates().size() + " exceeds threshold "
                    + thresholds.getMaxDuplicates());
        }
        completeness(report.getCompletenessIssues().size(), violations);
        return result(violations);
    }

    public ThresholdCheckResult check(NodeAuditReport report) {
        List<String> violations = new ArrayList<>();
        for (LayerSummary summary : report.getLayerSummaries()) {
            if (summary.getNodeTypeCount() == 0) {
                continue;
            }
            if (summary.getAverageQuality() < thresholds.getMinAverageQuality()) {
                violations.add(String.format(Locale.ROOT, "Layer %s: average quality %.1f below threshold %.1f",
                        summary.getLayer(), summary.getAverageQuality(), thresholds.getMinAverageQuality()));
            }
            if (summary.getEmptyDescriptions() > thresholds.getMaxEmptyDescriptionsPerLayer()) {
                violations.add("Layer " + summary.getLayer() + ": " + summary.getEmptyDescriptions()
                        + " empty descriptions exceed threshold " + thresholds.getMaxEmptyDescriptionsPerLayer());
            }
            if (summary.getGenericDescriptions() > thresholds.getMaxGenericDescriptionsPerLayer()) {
                violations.add("Layer " + summary.getLayer() + ": " + summary.getGenericDescriptions()
                        + " generic descriptions exceed threshold " + thresholds.getMaxGenericDescriptionsPerLayer());
            }
        }

        completeness(report.getCompletenessIssues().size(), violations);
        long highOverlaps = report.getOverlaps().stream().filter(o -> o.getConfidence() == Confidence.HIGH).count();
        if (highOverlaps > thresholds.getMaxHighConfidenceOverlaps()) {
            violations.add("High-confidence overlaps: " + highOverlaps + " exceeds threshold "
                    + thresholds.getMaxHighConfidenceOverlaps());
        }
        return result(violations);
    }

    private void completeness(int issues, List<String> violations) {
        if (issues > thresholds.getMaxCompletenessIssues()) {
            violations.add("Schema completeness: " + issues
                    + " issue(s) found (threshold: " + thresholds.getMaxCompletenessIssues() + ")");
        }
    }

    private ThresholdCheckResult result(List<String> violations) {
        if (violations.isEmpty()) {
            log.info("All quality thresholds passed");
        } else {
            violations.forEach(v -> log.warn("Threshold violated: {}", v));
        }
        return ThresholdCheckResult.builder().violations(violations).build();
    }
}
