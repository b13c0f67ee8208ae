package com.architecture.memory.specaudit.service.pipeline;

import com.architecture.memory.specaudit.dto.finding.BalanceIssue;
import com.architecture.memory.specaudit.dto.finding.CoverageMetric;
import com.architecture.memory.specaudit.dto.finding.DuplicateCandidate;
import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.report.*;
import com.architecture.memory.specaudit.model.RelationshipType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.analyzer.CoverageAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Compares a before/after pair of graphs and their reports.
 */
@Service
@Slf4j
public class DifferentialAnalyzer {

    public DifferentialSummary compare(SchemaGraph beforeGraph, AuditReport before,
                                       SchemaGraph afterGraph, AuditReport after) {
        Set<String> beforeRelationships = relationshipIds(beforeGraph);
        Set<String> afterRelationships = relationshipIds(afterGraph);

        List<String> added = afterRelationships.stream()
                .filter(id -> !beforeRelationships.contains(id))
                .collect(Collectors.toList());
        long removed = beforeRelationships.stream().filter(id -> !afterRelationships.contains(id)).count();

        Set<String> gapsBefore = gapKeys(before.getGaps());
        Set<String> gapsAfter = gapKeys(after.getGaps());
        List<String> resolved = gapsBefore.stream().filter(k -> !gapsAfter.contains(k)).collect(Collectors.toList());
        long newGaps = gapsAfter.stream().filter(k -> !gapsBefore.contains(k)).count();
        long persistent = gapsBefore.stream().filter(gapsAfter::contains).count();

        double densityBefore = average(before.getCoverage(), CoverageMetric::getRelationshipsPerNodeType);
        double densityAfter = average(after.getCoverage(), CoverageMetric::getRelationshipsPerNodeType);

        DifferentialSummary summary = DifferentialSummary.builder()
                .relationshipsAdded(added.size())
                .relationshipsRemoved((int) removed)
                .gapsResolved(resolved.size())
                .newGaps((int) newGaps)
                .persistentGaps((int) persistent)
                .gapResolutionRate(gapsBefore.isEmpty() ? 0.0
                        : CoverageAnalyzer.round(100.0 * resolved.size() / gapsBefore.size()))
                .averageDensityBefore(densityBefore)
                .averageDensityAfter(densityAfter)
                .densityImprovement(CoverageAnalyzer.round(densityAfter - densityBefore))
                .averageIsolationBefore(average(before.getCoverage(), CoverageMetric::getIsolationPercentage))
                .averageIsolationAfter(average(after.getCoverage(), CoverageMetric::getIsolationPercentage))
                .addedRelationships(added)
                .resolvedGaps(resolved)
                .layerDeltas(layerDeltas(before, after))
                .duplicateChanges(duplicateChanges(before.getDuplicates(), after.getDuplicates()))
                .balanceChanges(balanceChanges(before.getBalance(), after.getBalance()))
                .connectivityChanges(connectivityChanges(before.getConnectivity(), after.getConnectivity()))
                .build();

        log.info("Differential: +{} relationships, {} gaps resolved, density {} -> {}",
                summary.getRelationshipsAdded(), summary.getGapsResolved(), densityBefore, densityAfter);
        return summary;
    }

    private List<LayerDelta> layerDeltas(AuditReport before, AuditReport after) {
        Map<String, CoverageMetric> afterByLayer = after.getCoverage().stream()
                .collect(Collectors.toMap(CoverageMetric::getLayer, c -> c, (a, b) -> a));
        List<LayerDelta> deltas = new ArrayList<>();
        for (CoverageMetric b : before.getCoverage()) {
            CoverageMetric a = afterByLayer.getOrDefault(b.getLayer(), b);
            deltas.add(LayerDelta.builder()
                    .layer(b.getLayer())
                    .relationshipsBefore(b.getRelationshipCount())
                    .relationshipsAfter(a.getRelationshipCount())
                    .densityBefore(b.getRelationshipsPerNodeType())
                    .densityAfter(a.getRelationshipsPerNodeType())
                    .isolationBefore(b.getIsolationPercentage())
                    .isolationAfter(a.getIsolationPercentage())
                    .gapsBefore(countGaps(before.getGaps(), b.getLayer()))
                    .gapsAfter(countGaps(after.getGaps(), b.getLayer()))
                    .build());
        }
        return deltas;
    }

    private DuplicateChanges duplicateChanges(List<DuplicateCandidate> before, List<DuplicateCandidate> after) {
        Set<String> pairsBefore = duplicateKeys(before);
        Set<String> pairsAfter = duplicateKeys(after);
        List<String> resolved = pairsBefore.stream().filter(k -> !pairsAfter.contains(k)).collect(Collectors.toList());
        return DuplicateChanges.builder()
                .duplicatesBefore(pairsBefore.size())
                .duplicatesAfter(pairsAfter.size())
                .resolved(resolved)
                .newDuplicates(pairsAfter.stream().filter(k -> !pairsBefore.contains(k)).collect(Collectors.toList()))
                .persistent(pairsAfter.stream().filter(pairsBefore::contains).collect(Collectors.toList()))
                .eliminationRate(pairsBefore.isEmpty() ? 0.0
                        : CoverageAnalyzer.round(100.0 * resolved.size() / pairsBefore.size()))
                .build();
    }

    /**
     * Distance from balance is how far the relationship count sits from the middle of the
     * target range. A node type that is no outlier after the change counts as newly balanced.
     */
    private BalanceChanges balanceChanges(BalanceReport before, BalanceReport after) {
        if (before == null || after == null) {
            return BalanceChanges.builder().build();
        }
        Map<String, BalanceIssue> outliersAfter = new TreeMap<>();
        after.getIssues().forEach(i -> outliersAfter.put(i.getNodeType(), i));
        Map<String, Integer> countsAfter = new HashMap<>();
        after.getLayers().forEach(l -> countsAfter.putAll(l.getRelationshipCounts()));

        List<String> improvements = new ArrayList<>();
        List<String> regressions = new ArrayList<>();
        List<String> newlyBalanced = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (BalanceIssue b : before.getIssues()) {
            seen.add(b.getNodeType());
            BalanceIssue a = outliersAfter.get(b.getNodeType());
            int countAfter = a != null ? a.getRelationshipCount()
                    : countsAfter.getOrDefault(b.getNodeType(), b.getRelationshipCount());
            double distanceBefore = distanceFromBalance(b, b.getRelationshipCount());
            double distanceAfter = distanceFromBalance(b, countAfter);
            if (distanceAfter < distanceBefore) {
                improvements.add(b.getNodeType());
            } else if (distanceAfter > distanceBefore) {
                regressions.add(b.getNodeType());
            }
            if (a == null) {
                newlyBalanced.add(b.getNodeType());
            }
        }
        // balanced before, outlier after
        outliersAfter.keySet().stream().filter(id -> !seen.contains(id)).forEach(regressions::add);

        return BalanceChanges.builder()
                .outliersBefore(before.getIssues().size())
                .outliersAfter(after.getIssues().size())
                .improvements(improvements)
                .regressions(regressions)
                .newlyBalanced(newlyBalanced)
                .build();
    }

    private static double distanceFromBalance(BalanceIssue issue, int count) {
        return Math.abs(count - (issue.getTargetMin() + issue.getTargetMax()) / 2.0);
    }

    private ConnectivityComparison connectivityChanges(ConnectivityReport before, ConnectivityReport after) {
        if (before == null || after == null) {
            return ConnectivityComparison.builder().build();
        }
        ConnectivityStats b = before.getStats();
        ConnectivityStats a = after.getStats();
        return ConnectivityComparison.builder()
                .componentsBefore(b.getComponentCount())
                .componentsAfter(a.getComponentCount())
                .isolatedBefore(b.getIsolatedCount())
                .isolatedAfter(a.getIsolatedCount())
                .averageDegreeBefore(b.getAverageDegree())
                .averageDegreeAfter(a.getAverageDegree())
                .componentChange(a.getComponentCount() - b.getComponentCount())
                .isolationChange(a.getIsolatedCount() - b.getIsolatedCount())
                .degreeChange(CoverageAnalyzer.round(a.getAverageDegree() - b.getAverageDegree()))
                .build();
    }

    private static int countGaps(List<GapCandidate> gaps, String layer) {
        String prefix = layer + ".";
        return (int) gaps.stream().filter(g -> g.getSourceNodeType().startsWith(prefix)).count();
    }

    private static Set<String> relationshipIds(SchemaGraph graph) {
        return graph.getRelationships().stream()
                .map(RelationshipType::tripleKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static Set<String> gapKeys(List<GapCandidate> gaps) {
        return gaps.stream().map(GapCandidate::key).collect(Collectors.toCollection(TreeSet::new));
    }

    private static Set<String> duplicateKeys(List<DuplicateCandidate> duplicates) {
        return duplicates.stream()
                .map(d -> d.getRelationshipA().compareTo(d.getRelationshipB()) <= 0
                        ? d.getRelationshipA() + " ~ " + d.getRelationshipB()
                        : d.getRelationshipB() + " ~ " + d.getRelationshipA())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static double average(List<CoverageMetric> coverage, ToDoubleFunction<CoverageMetric> metric) {
        return CoverageAnalyzer.round(coverage.stream().mapToDouble(metric).average().orElse(0.0));
    }
}
