package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.ConnectivityIssue;
import com.architecture.memory.specaudit.dto.report.ConnectivityReport;
import com.architecture.memory.specaudit.dto.report.ConnectivityStats;
import com.architecture.memory.specaudit.model.Predicate;
import com.architecture.memory.specaudit.model.RelationshipType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Treats all layers as one directed graph of node types.
 *
 * Computes weakly connected components, isolated node types, average degree, transitive
 * chains and cross-layer references that run against the layer ordering (references flow
 * from higher-numbered layers to lower-numbered ones).
 */
@Service
@Slf4j
public class ConnectivityAnalyzer {

    private static final int VIOLATION_ALIGNMENT = 40;

    public ConnectivityReport analyze(SchemaGraph graph) {
        log.info("Running connectivity analysis over {} node types", graph.getNodeTypes().size());

        Map<String, Set<String>> undirected = buildUndirectedAdjacency(graph);
        List<List<String>> components = findComponents(undirected);
        List<String> isolated = graph.getNodeTypes().keySet().stream()
                .filter(graph::isIsolated)
                .collect(Collectors.toList());
        List<List<String>> chains = findTransitiveChains(graph);
        List<ConnectivityIssue> issues = findDirectionViolations(graph);

        int nodeCount = graph.getNodeTypes().size();
        int degreeSum = graph.getNodeTypes().keySet().stream().mapToInt(graph::degree).sum();
        long crossLayer = graph.getRelationships().stream().filter(r -> !r.isIntraLayer()).count();
        double compliance = crossLayer == 0 ? 100.0
                : CoverageAnalyzer.round(100.0 * (crossLayer - issues.size()) / crossLayer);

        ConnectivityStats stats = ConnectivityStats.builder()
                .nodeTypeCount(nodeCount)
                .relationshipCount(graph.getRelationships().size())
                .componentCount(components.size())
                .largestComponentSize(components.isEmpty() ? 0 : components.get(0).size())
                .isolatedCount(isolated.size())
                .averageDegree(nodeCount == 0 ? 0.0 : CoverageAnalyzer.round((double) degreeSum / nodeCount))
                .transitiveChainCount(chains.size())
                .layerCompliancePercentage(compliance)
                .build();

        log.info("Connectivity: {} components, {} isolated, {} direction violations",
                components.size(), isolated.size(), issues.size());

        return ConnectivityReport.builder()
                .stats(stats)
                .components(components)
                .isolatedNodeTypes(isolated)
                .transitiveChains(chains)
                .issues(issues)
                .build();
    }

    // ========================= COMPONENTS =========================

    private Map<String, Set<String>> buildUndirectedAdjacency(SchemaGraph graph) {
        Map<String, Set<String>> adjacency = new TreeMap<>();
        graph.getNodeTypes().keySet().forEach(id -> adjacency.put(id, new TreeSet<>()));
        for (RelationshipType rel : graph.getRelationships()) {
            adjacency.get(rel.getSourceSpecNodeId()).add(rel.getDestinationSpecNodeId());
            adjacency.get(rel.getDestinationSpecNodeId()).add(rel.getSourceSpecNodeId());
        }
        return adjacency;
    }

    /**
     * Breadth-first traversal from every unvisited node. Components are sorted largest first,
     * then by their first member.
     */
    private List<List<String>> findComponents(Map<String, Set<String>> adjacency) {
        List<List<String>> components = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (String start : adjacency.keySet()) {
            if (!visited.add(start)) {
                continue;
            }
            List<String> component = new ArrayList<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                component.add(current);
                for (String neighbor : adjacency.getOrDefault(current, Collections.emptySet())) {
                    if (visited.add(neighbor)) {
                        queue.add(neighbor);
                    }
                }
            }
            Collections.sort(component);
            components.add(component);
        }

        components.sort(Comparator.comparingInt((List<String> c) -> c.size()).reversed()
                .thenComparing(c -> c.get(0)));
        return components;
    }

    // ========================= TRANSITIVE CHAINS =========================

    /**
     * Two consecutive edges carrying the same transitive predicate: {@code a -p-> b -p-> c}.
     */
    private List<List<String>> findTransitiveChains(SchemaGraph graph) {
        List<List<String>> chains = new ArrayList<>();
        for (RelationshipType first : graph.getRelationships()) {
            boolean transitive = graph.getPredicate(first.getPredicate())
                    .map(Predicate::getSemantics)
                    .map(s -> s.isTransitive())
                    .orElse(false);
            if (!transitive) {
                continue;
            }
            for (RelationshipType second : graph.outgoing(first.getDestinationSpecNodeId())) {
                if (second.getPredicate().equals(first.getPredicate())
                        && !second.getDestinationSpecNodeId().equals(first.getSourceSpecNodeId())
                        && !second.getId().equals(first.getId())) {
                    chains.add(List.of(first.getSourceSpecNodeId(), first.getPredicate(),
                            first.getDestinationSpecNodeId(), second.getDestinationSpecNodeId()));
                }
            }
        }
        return chains;
    }

    // ========================= LAYER DIRECTION =========================

    private List<ConnectivityIssue> findDirectionViolations(SchemaGraph graph) {
        List<ConnectivityIssue> issues = new ArrayList<>();
        for (RelationshipType rel : graph.getRelationships()) {
            if (rel.isIntraLayer()) {
                continue;
            }
            int sourceNumber = graph.layerNumber(rel.getSourceLayer());
            int destinationNumber = graph.layerNumber(rel.getDestinationLayer());
            if (sourceNumber == Integer.MAX_VALUE || destinationNumber == Integer.MAX_VALUE) {
                continue;
            }
            if (sourceNumber < destinationNumber) {
                issues.add(ConnectivityIssue.builder()
                        .kind(ConnectivityIssue.Kind.LAYER_DIRECTION_VIOLATION)
                        .relationshipId(rel.getId())
                        .sourceNodeType(rel.getSourceSpecNodeId())
                        .destinationNodeType(rel.getDestinationSpecNodeId())
                        .sourceLayer(rel.getSourceLayer())
                        .destinationLayer(rel.getDestinationLayer())
                        .alignmentScore(VIOLATION_ALIGNMENT)
                        .reasoning("Layer " + rel.getSourceLayer() + " (" + sourceNumber + ") references higher layer "
                                + rel.getDestinationLayer() + " (" + destinationNumber + ")")
                        .standardReference(graph.findLayer(rel.getSourceLayer())
                                .map(l -> l.getStandardReference()).orElse(null))
                        .build());
            }
        }
        return issues;
    }
}
