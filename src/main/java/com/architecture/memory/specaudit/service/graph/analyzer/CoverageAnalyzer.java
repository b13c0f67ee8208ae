package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.CoverageMetric;
import com.architecture.memory.specaudit.model.Layer;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.RelationshipType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Per-layer coverage: counts, isolation, density and predicate utilization.
 * A pure function of the graph.
 */
@Service
@Slf4j
public class CoverageAnalyzer {

    public List<CoverageMetric> analyze(SchemaGraph graph) {
        log.info("Running coverage analysis for {} layers", graph.getLayers().size());
        return graph.getLayers().stream()
                .map(layer -> analyzeLayer(graph, layer))
                .collect(Collectors.toList());
    }

    public CoverageMetric analyzeLayer(SchemaGraph graph, Layer layer) {
        List<NodeType> nodeTypes = graph.nodeTypesInLayer(layer.getId());
        Set<String> members = nodeTypes.stream().map(NodeType::getSpecNodeId).collect(Collectors.toSet());

        int intra = 0;
        int inter = 0;
        int sourced = 0;
        Set<String> usedPredicates = new TreeSet<>();
        for (RelationshipType rel : graph.getRelationships()) {
            boolean sourceIn = members.contains(rel.getSourceSpecNodeId());
            boolean destinationIn = members.contains(rel.getDestinationSpecNodeId());
            if (sourceIn && destinationIn) {
                intra++;
            } else if (sourceIn || destinationIn) {
                inter++;
            }
            if (sourceIn) {
                sourced++;
                usedPredicates.add(rel.getPredicate());
            }
        }

        List<String> isolated = nodeTypes.stream()
                .map(NodeType::getSpecNodeId)
                .filter(graph::isIsolated)
                .sorted()
                .collect(Collectors.toList());

        int n = nodeTypes.size();
        double isolation = (n == 0 || intra + inter == 0) ? 100.0 : round(isolated.size() * 100.0 / n);
        double density = round((double) sourced / Math.max(n, 1));
        int catalogSize = graph.getPredicates().size();
        double utilization = catalogSize == 0 ? 0.0 : round(usedPredicates.size() * 100.0 / catalogSize);

        log.debug("Layer {}: {} node types, {} relationships, {}% isolated, density {}",
                layer.getId(), n, sourced, isolation, density);

        return CoverageMetric.builder()
                .layer(layer.getId())
                .layerNumber(layer.getNumber())
                .nodeTypeCount(n)
                .intraLayerRelationships(intra)
                .interLayerRelationships(inter)
                .relationshipCount(sourced)
                .isolatedNodeTypes(isolated)
                .isolationPercentage(isolation)
                .relationshipsPerNodeType(density)
                .usedPredicates(new ArrayList<>(usedPredicates))
                .utilizationPercentage(utilization)
                .alignmentScore((int) Math.round(100.0 - isolation))
                .reasoning(String.format(Locale.ROOT, "%d of %d node types isolated; %d relationships (%.2f per node type)",
                        isolated.size(), n, sourced, density))
                .standardReference(layer.getStandardReference())
                .build();
    }

    public static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
