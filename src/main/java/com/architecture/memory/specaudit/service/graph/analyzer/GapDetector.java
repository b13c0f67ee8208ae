package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.CoverageMetric;
import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.finding.Priority;
import com.architecture.memory.specaudit.model.*;
import com.architecture.memory.specaudit.service.graph.ScoreTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Proposes missing relationship types.
 *
 * Candidates come from three sources, in order:
 * 1. reference-standard templates of the layer
 * 2. relationships of structurally similar node types in the same layer
 * 3. a fallback linking every still uncovered isolated node type to the best-connected node type of its
 *    own layer, else of the nearest lower layer, else of the nearest higher layer (as the referencing side)
 *
 * Candidates repeating an existing relationship or an earlier candidate are dropped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GapDetector {

    private static final String FALLBACK_PREDICATE = "references";

    private final CoverageAnalyzer coverageAnalyzer;
    private final RelationshipTemplateCatalog templateCatalog;
    private final GapPriorityPolicy priorityPolicy;

    public List<GapCandidate> detect(SchemaGraph graph) {
        List<CoverageMetric> coverage = coverageAnalyzer.analyze(graph);
        return detect(graph, coverage);
    }

    public List<GapCandidate> detect(SchemaGraph graph, List<CoverageMetric> coverage) {
        log.info("Running gap detection for {} layers", graph.getLayers().size());
        Map<String, CoverageMetric> coverageByLayer = coverage.stream()
                .collect(Collectors.toMap(CoverageMetric::getLayer, Function.identity()));

        Map<String, GapCandidate> candidates = new LinkedHashMap<>();
        for (Layer layer : graph.getLayers()) {
            CoverageMetric metric = coverageByLayer.get(layer.getId());
            if (metric == null) {
                metric = coverageAnalyzer.analyzeLayer(graph, layer);
            }
            detectTemplateGaps(graph, layer, metric, candidates);
            detectSimilarNodeGaps(graph, layer, metric, candidates);
            detectHubGaps(graph, layer, metric, candidates);
        }

        log.info("Gap detection proposed {} candidates", candidates.size());
        return new ArrayList<>(candidates.values());
    }

    // ========================= TEMPLATES =========================

    private void detectTemplateGaps(SchemaGraph graph, Layer layer, CoverageMetric metric,
                                    Map<String, GapCandidate> candidates) {
        List<NodeType> nodeTypes = graph.nodeTypesInLayer(layer.getId());
        for (RelationshipTemplateCatalog.Template template : templateCatalog.templatesFor(layer.getId())) {
            if (graph.getPredicate(template.getPredicate()).isEmpty()) {
                log.debug("Template predicate '{}' is not in the catalog, skipping", template.getPredicate());
                continue;
            }
            for (NodeType source : matching(nodeTypes, template.getSourceType())) {
                for (NodeType destination : matching(nodeTypes, template.getDestinationType())) {
                    if (source.getSpecNodeId().equals(destination.getSpecNodeId())) {
                        continue;
                    }
                    String reference = template.getStandardReference() != null
                            ? template.getStandardReference() : layer.getStandardReference();
                    offer(graph, metric, candidates, source, destination, template.getPredicate(),
                            template.getReason(), reference, GapCandidate.Origin.TEMPLATE);
                }
            }
        }
    }

    private List<NodeType> matching(List<NodeType> nodeTypes, String pattern) {
        return nodeTypes.stream()
                .filter(n -> n.getType().toLowerCase(Locale.ROOT).contains(pattern))
                .collect(Collectors.toList());
    }

    // ========================= SIMILAR NODE TYPES =========================

    /**
     * Node types below the layer baseline borrow the outgoing relationships of their most
     * similar well-connected peer.
     */
    private void detectSimilarNodeGaps(SchemaGraph graph, Layer layer, CoverageMetric metric,
                                       Map<String, GapCandidate> candidates) {
        List<NodeType> nodeTypes = graph.nodeTypesInLayer(layer.getId());
        double baseline = metric.getRelationshipsPerNodeType();

        for (NodeType node : nodeTypes) {
            int degree = graph.degree(node.getSpecNodeId());
            if (degree > 0 && degree >= baseline) {
                continue;
            }
            Optional<NodeType> peer = mostSimilarPeer(graph, node, nodeTypes);
            if (peer.isEmpty()) {
                continue;
            }
            for (RelationshipType rel : graph.outgoing(peer.get().getSpecNodeId())) {
                if (rel.getDestinationSpecNodeId().equals(node.getSpecNodeId())) {
                    continue;
                }
                graph.findNodeType(rel.getDestinationSpecNodeId()).ifPresent(destination ->
                        offer(graph, metric, candidates, node, destination, rel.getPredicate(),
                                "Similar node type " + peer.get().getSpecNodeId() + " "
                                        + rel.getPredicate() + " " + destination.getSpecNodeId(),
                                layer.getStandardReference(), GapCandidate.Origin.SIMILAR_NODE_TYPE));
            }
        }
    }

    private Optional<NodeType> mostSimilarPeer(SchemaGraph graph, NodeType node, List<NodeType> layerTypes) {
        Set<String> signature = signature(node);
        NodeType best = null;
        double bestScore = 0.0;
        for (NodeType other : layerTypes) {
            if (other == node || graph.outgoing(other.getSpecNodeId()).isEmpty()) {
                continue;
            }
            double score = TextSimilarity.jaccard(signature, signature(other));
            if (score > bestScore) {
                best = other;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    private Set<String> signature(NodeType node) {
        Set<String> signature = new TreeSet<>(TextSimilarity.tokens(node.getType()));
        node.getAttributes().forEach(a -> signature.add("attr:" + a.getName()));
        return signature;
    }

    // ========================= LAYER HUB FALLBACK =========================

    private void detectHubGaps(SchemaGraph graph, Layer layer, CoverageMetric metric,
                               Map<String, GapCandidate> candidates) {
        Set<String> covered = new HashSet<>();
        candidates.values().forEach(c -> {
            covered.add(c.getSourceNodeType());
            covered.add(c.getDestinationNodeType());
        });

        for (String isolatedId : metric.getIsolatedNodeTypes()) {
            if (covered.contains(isolatedId)) {
                continue;
            }
            NodeType isolated = graph.findNodeType(isolatedId).orElseThrow();
            Optional<String> predicate = mostUsedPredicate(graph, layer.getId());
            if (predicate.isEmpty()) {
                log.debug("No predicate available for isolated node type {}", isolatedId);
                continue;
            }

            Optional<NodeType> hub = hub(graph, layer.getId(), isolatedId)
                    .or(() -> lowerLayerHub(graph, layer, isolatedId));
            if (hub.isPresent()) {
                offer(graph, metric, candidates, isolated, hub.get(), predicate.get(),
                        isolatedId + " has no relationships; link it to the best-connected node type "
                                + hub.get().getSpecNodeId(),
                        layer.getStandardReference(), GapCandidate.Origin.LAYER_HUB);
                continue;
            }

            // only higher layers are left; references run from the higher layer down
            Optional<NodeType> upperHub = higherLayerHub(graph, layer, isolatedId);
            if (upperHub.isEmpty()) {
                log.debug("No hub available for isolated node type {}", isolatedId);
                continue;
            }
            offer(graph, metric, candidates, upperHub.get(), isolated, predicate.get(),
                    isolatedId + " has no relationships; let the best-connected node type "
                            + upperHub.get().getSpecNodeId() + " reference it",
                    layer.getStandardReference(), GapCandidate.Origin.LAYER_HUB);
        }
    }

    private Optional<NodeType> hub(SchemaGraph graph, String layerId, String excludedId) {
        return graph.nodeTypesInLayer(layerId).stream()
                .filter(n -> !n.getSpecNodeId().equals(excludedId))
                .max(Comparator.comparingInt((NodeType n) -> graph.degree(n.getSpecNodeId()))
                        .thenComparing(NodeType::getSpecNodeId, Comparator.reverseOrder()));
    }

    /**
     * Hub of the nearest layer numbered at or below the given one.
     */
    private Optional<NodeType> lowerLayerHub(SchemaGraph graph, Layer layer, String excludedId) {
        List<Layer> lower = graph.getLayers().stream()
                .filter(l -> !l.getId().equals(layer.getId()) && l.getNumber() <= layer.getNumber())
                .collect(Collectors.toList());
        Collections.reverse(lower);
        return firstHub(graph, lower, excludedId);
    }

    private Optional<NodeType> higherLayerHub(SchemaGraph graph, Layer layer, String excludedId) {
        return firstHub(graph, graph.getLayers().stream()
                .filter(l -> l.getNumber() > layer.getNumber())
                .collect(Collectors.toList()), excludedId);
    }

    private Optional<NodeType> firstHub(SchemaGraph graph, List<Layer> layers, String excludedId) {
        for (Layer candidate : layers) {
            Optional<NodeType> hub = hub(graph, candidate.getId(), excludedId);
            if (hub.isPresent()) {
                return hub;
            }
        }
        return Optional.empty();
    }

    /**
     * Most used predicate of the layer, then of the whole graph, then a generic catalog entry.
     */
    private Optional<String> mostUsedPredicate(SchemaGraph graph, String layerId) {
        Optional<String> layerPredicate = mostUsed(graph.getRelationships().stream()
                .filter(r -> layerId.equals(r.getSourceLayer()))
                .collect(Collectors.toList()));
        if (layerPredicate.isPresent()) {
            return layerPredicate;
        }
        Optional<String> graphPredicate = mostUsed(graph.getRelationships());
        if (graphPredicate.isPresent()) {
            return graphPredicate;
        }
        if (graph.getPredicates().containsKey(FALLBACK_PREDICATE)) {
            return Optional.of(FALLBACK_PREDICATE);
        }
        return graph.getPredicates().keySet().stream().findFirst();
    }

    private Optional<String> mostUsed(List<RelationshipType> relationships) {
        Map<String, Long> counts = relationships.stream()
                .collect(Collectors.groupingBy(RelationshipType::getPredicate, TreeMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey);
    }

    // ========================= CANDIDATES =========================

    private void offer(SchemaGraph graph, CoverageMetric metric, Map<String, GapCandidate> candidates,
                       NodeType source, NodeType destination, String predicate, String reason,
                       String standardReference, GapCandidate.Origin origin) {
        String key = RelationshipType.tripleKey(source.getSpecNodeId(), predicate, destination.getSpecNodeId());
        if (candidates.containsKey(key)
                || graph.hasRelationship(source.getSpecNodeId(), predicate, destination.getSpecNodeId())) {
            return;
        }

        Priority priority = priorityPolicy.assess(new GapPriorityPolicy.GapContext(
                source.getLayerId(),
                metric.getRelationshipCount(),
                source.getType(),
                graph.isIsolated(source.getSpecNodeId()),
                origin,
                standardReference));

        candidates.put(key, GapCandidate.builder()
                .sourceNodeType(source.getSpecNodeId())
                .destinationNodeType(destination.getSpecNodeId())
                .suggestedPredicate(predicate)
                .reason(reason)
                .priority(priority)
                .standardReference(standardReference)
                .impactScore(ScoreTable.gapImpact(priority))
                .alignmentScore(ScoreTable.gapAlignment(priority))
                .origin(origin)
                .build());
    }
}
