package com.architecture.memory.specaudit.service.pipeline;

import com.architecture.memory.specaudit.dto.finding.CoverageMetric;
import com.architecture.memory.specaudit.dto.finding.DuplicateCandidate;
import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.recommendation.EvaluationRequest;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.dto.report.AuditReport;
import com.architecture.memory.specaudit.dto.report.DifferentialSummary;
import com.architecture.memory.specaudit.dto.report.PipelineResult;
import com.architecture.memory.specaudit.dto.report.PipelineResult.ExternalStatus;
import com.architecture.memory.specaudit.exception.EvaluatorUnavailableException;
import com.architecture.memory.specaudit.model.Layer;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.RelationshipType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.llm.BoundedRecommendationInvoker;
import com.architecture.memory.specaudit.service.report.ReportAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs the baseline audit and, when requested, the external recommendation step.
 *
 * The external step is fail-soft: once the recommendation source is unavailable or the run is
 * aborted, no further calls are made and only the baseline report is returned. Deterministic
 * analysis errors propagate.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final ReportAssembler reportAssembler;
    private final BoundedRecommendationInvoker invoker;
    private final RecommendationMerger merger;
    private final DifferentialAnalyzer differentialAnalyzer;

    public PipelineResult run(SchemaGraph graph, PipelineOptions options) {
        AuditReport before = reportAssembler.assembleRelationshipAudit(graph, options.getLayerFilter());
        if (!options.isEnableExternal()) {
            return PipelineResult.builder()
                    .before(before)
                    .mergedGaps(before.getGaps())
                    .externalStatus(ExternalStatus.DISABLED)
                    .build();
        }

        List<EvaluationRequest> requests = buildRequests(graph, before);
        log.info("Starting external evaluation with {} requests", requests.size());

        AbortSignal abort = options.getAbortSignal();
        List<RecommendationRecord> records = new ArrayList<>();
        int sent = 0;
        int failed = 0;
        for (EvaluationRequest request : requests) {
            sent++;
            try {
                records.addAll(invoker.invoke(request, abort));
            } catch (EvaluatorUnavailableException e) {
                ExternalStatus status = abort.isAborted() ? ExternalStatus.ABORTED : ExternalStatus.UNAVAILABLE;
                log.warn("External evaluation stopped after {} of {} requests: {}", sent, requests.size(), e.getMessage());
                return PipelineResult.builder()
                        .before(before)
                        .mergedGaps(before.getGaps())
                        .externalStatus(status)
                        .statusMessage(e.getMessage())
                        .requestsSent(sent)
                        .failedRequests(failed + 1)
                        .build();
            } catch (RuntimeException e) {
                failed++;
                log.warn("Recommendation request for {} failed: {}", request.describe(), e.getMessage());
            }
        }

        List<RecommendationRecord> accepted = merger.acceptable(graph, records);
        List<GapCandidate> mergedGaps = merger.merge(before.getGaps(), accepted);
        List<RelationshipType> projected = accepted.stream()
                .map(r -> merger.toRelationship(graph, r))
                .collect(Collectors.toList());

        SchemaGraph afterGraph = graph.withProjectedRelationships(projected);
        AuditReport after = reportAssembler.assembleRelationshipAudit(afterGraph, options.getLayerFilter());
        DifferentialSummary differential = differentialAnalyzer.compare(graph, before, afterGraph, after);

        log.info("External evaluation completed: {} requests, {} failed, {} records, {} accepted",
                sent, failed, records.size(), accepted.size());

        return PipelineResult.builder()
                .before(before)
                .after(after)
                .differential(differential)
                .externalStatus(ExternalStatus.COMPLETED)
                .requestsSent(sent)
                .failedRequests(failed)
                .recommendations(records)
                .mergedGaps(mergedGaps)
                .build();
    }

    // ========================= REQUESTS =========================

    /**
     * One request per isolated node type, one per layer with isolation, one per duplicate pair.
     */
    List<EvaluationRequest> buildRequests(SchemaGraph graph, AuditReport before) {
        List<String> predicates = new ArrayList<>(graph.getPredicates().keySet());
        List<EvaluationRequest> requests = new ArrayList<>();

        for (CoverageMetric coverage : before.getCoverage()) {
            Layer layer = graph.findLayer(coverage.getLayer()).orElseThrow();
            List<RelationshipType> layerRelationships = graph.getRelationships().stream()
                    .filter(r -> layer.getId().equals(r.getSourceLayer()) || layer.getId().equals(r.getDestinationLayer()))
                    .collect(Collectors.toList());

            for (String isolated : coverage.getIsolatedNodeTypes()) {
                graph.findNodeType(isolated).ifPresent(nodeType -> requests.add(EvaluationRequest.builder()
                        .kind(EvaluationRequest.Kind.NODE_TYPE)
                        .layer(layer)
                        .nodeTypes(List.of(nodeType))
                        .existingRelationships(layerRelationships)
                        .availablePredicates(predicates)
                        .context("Other node types in the layer: " + peers(graph, layer, isolated))
                        .build()));
            }
        }

        for (CoverageMetric coverage : before.getCoverage()) {
            if (coverage.getIsolationPercentage() <= 0 || coverage.getNodeTypeCount() == 0) {
                continue;
            }
            Layer layer = graph.findLayer(coverage.getLayer()).orElseThrow();
            requests.add(EvaluationRequest.builder()
                    .kind(EvaluationRequest.Kind.LAYER)
                    .layer(layer)
                    .nodeTypes(graph.nodeTypesInLayer(layer.getId()))
                    .existingRelationships(graph.getRelationships().stream()
                            .filter(r -> layer.getId().equals(r.getSourceLayer()))
                            .collect(Collectors.toList()))
                    .availablePredicates(predicates)
                    .context("Isolated node types: " + String.join(", ", coverage.getIsolatedNodeTypes()))
                    .build());
        }

        for (DuplicateCandidate duplicate : before.getDuplicates()) {
            Optional<NodeType> source = graph.findNodeType(duplicate.getSourceNodeType());
            Optional<NodeType> destination = graph.findNodeType(duplicate.getDestinationNodeType());
            if (source.isEmpty() || destination.isEmpty()) {
                continue;
            }
            List<RelationshipType> between = new ArrayList<>(
                    graph.relationshipsBetween(source.get().getSpecNodeId(), destination.get().getSpecNodeId()));
            if (!source.get().getSpecNodeId().equals(destination.get().getSpecNodeId())) {
                between.addAll(graph.relationshipsBetween(destination.get().getSpecNodeId(), source.get().getSpecNodeId()));
            }
            requests.add(EvaluationRequest.builder()
                    .kind(EvaluationRequest.Kind.NODE_TYPE_PAIR)
                    .layer(graph.findLayer(source.get().getLayerId()).orElse(null))
                    .nodeTypes(List.of(source.get(), destination.get()))
                    .existingRelationships(between)
                    .availablePredicates(predicates)
                    .context(duplicate.getReasoning())
                    .build());
        }
        return requests;
    }

    private String peers(SchemaGraph graph, Layer layer, String excluded) {
        return graph.nodeTypesInLayer(layer.getId()).stream()
                .map(NodeType::getSpecNodeId)
                .filter(id -> !id.equals(excluded))
                .collect(Collectors.joining(", "));
    }
}
