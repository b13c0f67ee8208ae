package com.architecture.memory.specaudit.service.report;

import com.architecture.memory.specaudit.dto.finding.*;
import com.architecture.memory.specaudit.dto.report.*;
import com.architecture.memory.specaudit.exception.AuditExecutionException;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.analyzer.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Runs the analyzers over one graph and merges their findings into a canonical report.
 * Any analyzer failure propagates and is fatal to the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportAssembler {

    private final CoverageAnalyzer coverageAnalyzer;
    private final GapDetector gapDetector;
    private final DuplicateDetector duplicateDetector;
    private final BalanceAnalyzer balanceAnalyzer;
    private final ConnectivityAnalyzer connectivityAnalyzer;
    private final NodeAuditAnalyzer nodeAuditAnalyzer;
    private final Clock clock;

    /**
     * Relationship audit. A non-null {@code layerFilter} scopes every finding to that layer.
     */
    public AuditReport assembleRelationshipAudit(SchemaGraph graph, String layerFilter) {
        requireLayer(graph, layerFilter);
        log.info("Assembling relationship audit{}", layerFilter != null ? " for layer " + layerFilter : "");

        List<CoverageMetric> coverage = coverageAnalyzer.analyze(graph);
        List<GapCandidate> gaps = gapDetector.detect(graph, coverage);
        List<DuplicateCandidate> duplicates = duplicateDetector.detect(graph);
        BalanceReport balance = balanceAnalyzer.analyze(graph);
        ConnectivityReport connectivity = connectivityAnalyzer.analyze(graph);
        List<CompletenessIssue> completeness = graph.getLoadIssues();

        if (layerFilter != null) {
            String prefix = layerFilter + ".";
            Predicate<String> inLayer = id -> id != null && id.startsWith(prefix);
            coverage = filter(coverage, c -> layerFilter.equals(c.getLayer()));
            gaps = filter(gaps, g -> inLayer.test(g.getSourceNodeType()));
            duplicates = filter(duplicates, d -> inLayer.test(d.getSourceNodeType()));
            balance = BalanceReport.builder()
                    .layers(filter(balance.getLayers(), l -> layerFilter.equals(l.getLayer())))
                    .issues(filter(balance.getIssues(), i -> layerFilter.equals(i.getLayer())))
                    .build();
            connectivity.setIssues(filter(connectivity.getIssues(),
                    i -> layerFilter.equals(i.getSourceLayer()) || layerFilter.equals(i.getDestinationLayer())));
            completeness = filter(completeness, c -> layerFilter.equals(c.getLayer()));
        }

        return AuditReport.builder()
                .model(graph.getMetadata())
                .timestamp(Instant.now(clock))
                .layerFilter(layerFilter)
                .coverage(coverage)
                .gaps(gaps)
                .duplicates(duplicates)
                .balance(balance)
                .connectivity(connectivity)
                .completenessIssues(completeness)
                .build();
    }

    public AuditReport assembleRelationshipAudit(SchemaGraph graph) {
        return assembleRelationshipAudit(graph, null);
    }

    /**
     * Node audit. Completeness issues are the problems recorded while loading the graph.
     */
    public NodeAuditReport assembleNodeAudit(SchemaGraph graph, String layerFilter) {
        requireLayer(graph, layerFilter);
        log.info("Assembling node audit{}", layerFilter != null ? " for layer " + layerFilter : "");

        List<DefinitionQualityFinding> quality = nodeAuditAnalyzer.assessDefinitions(graph);
        List<OverlapCandidate> overlaps = nodeAuditAnalyzer.detectOverlaps(graph);
        List<CompletenessIssue> completeness = graph.getLoadIssues();
        List<LayerAlignmentIssue> alignment = nodeAuditAnalyzer.detectLayerAlignment(graph);
        List<LayerSummary> summaries = nodeAuditAnalyzer.summarize(graph, quality, overlaps, completeness);

        if (layerFilter != null) {
            quality = filter(quality, q -> layerFilter.equals(q.getLayer()));
            overlaps = filter(overlaps, o -> layerFilter.equals(o.getLayer()));
            completeness = filter(completeness, c -> layerFilter.equals(c.getLayer()));
            alignment = filter(alignment, a -> layerFilter.equals(a.getCurrentLayer()));
            summaries = filter(summaries, s -> layerFilter.equals(s.getLayer()));
        }

        return NodeAuditReport.builder()
                .model(graph.getMetadata())
                .timestamp(Instant.now(clock))
                .layerFilter(layerFilter)
                .layerSummaries(summaries)
                .definitionQuality(quality)
                .overlaps(overlaps)
                .completenessIssues(completeness)
                .layerAlignment(alignment)
                .build();
    }

    private void requireLayer(SchemaGraph graph, String layerFilter) {
        if (layerFilter != null && graph.findLayer(layerFilter).isEmpty()) {
            throw new AuditExecutionException("Unknown layer: " + layerFilter);
        }
    }

    private static <T> List<T> filter(List<T> items, Predicate<T> predicate) {
        return items.stream().filter(predicate).collect(Collectors.toList());
    }
}
