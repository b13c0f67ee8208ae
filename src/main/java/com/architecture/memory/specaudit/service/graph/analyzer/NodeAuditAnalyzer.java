package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.*;
import com.architecture.memory.specaudit.dto.report.LayerSummary;
import com.architecture.memory.specaudit.model.*;
import com.architecture.memory.specaudit.service.graph.ScoreTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Audits node type definitions: description and attribute quality, semantic overlap between
 * node types of one layer, completeness of the loaded files and layer placement.
 */
@Service
@Slf4j
public class NodeAuditAnalyzer {

    static final int SHORT_DESCRIPTION = 40;
    static final double OVERLAP_HIGH = 0.7;
    static final double OVERLAP_MEDIUM = 0.5;
    static final double OVERLAP_LOW = 0.35;

    private static final Pattern PLACEHOLDER = Pattern.compile("^(todo|tbd|n/a|placeholder|description|none)\\b.*");
    private static final Set<String> GENERIC_VOCABULARY = Set.of(
            "node", "element", "type", "represents", "representing", "defines", "definition",
            "layer", "object", "item", "entity", "thing", "data", "model", "specification");

    /**
     * Definition quality for every node type, sorted by node type id.
     */
    public List<DefinitionQualityFinding> assessDefinitions(SchemaGraph graph) {
        return graph.getNodeTypes().values().stream()
                .map(n -> assess(n, graph.findLayer(n.getLayerId()).map(Layer::getStandardReference).orElse(null)))
                .collect(Collectors.toList());
    }

    DefinitionQualityFinding assess(NodeType nodeType, String standardReference) {
        String description = nodeType.getDescription() == null ? "" : nodeType.getDescription().trim();
        boolean empty = description.isEmpty();
        boolean generic = !empty && isGeneric(nodeType, description);
        List<String> undocumented = nodeType.getAttributes().stream()
                .filter(a -> !a.isDocumented())
                .map(AttributeDefinition::getName)
                .sorted()
                .collect(Collectors.toList());
        int attributeCount = nodeType.getAttributes().size();

        double score = 100;
        List<String> reasons = new ArrayList<>();
        if (empty) {
            score -= 50;
            reasons.add("description is empty");
        } else {
            if (generic) {
                score -= 25;
                reasons.add("description is generic");
            }
            if (description.length() < SHORT_DESCRIPTION) {
                score -= 10;
                reasons.add("description is shorter than " + SHORT_DESCRIPTION + " characters");
            }
        }
        if (attributeCount == 0) {
            score -= 10;
            reasons.add("no attributes are defined");
        } else if (!undocumented.isEmpty()) {
            score -= 30.0 * undocumented.size() / attributeCount;
            reasons.add(undocumented.size() + " of " + attributeCount + " attributes are undocumented");
        }
        int quality = (int) Math.max(0, Math.min(100, Math.round(score)));

        return DefinitionQualityFinding.builder()
                .nodeType(nodeType.getSpecNodeId())
                .layer(nodeType.getLayerId())
                .qualityScore(quality)
                .emptyDescription(empty)
                .genericDescription(generic)
                .attributeCount(attributeCount)
                .undocumentedAttributes(undocumented)
                .alignmentScore(quality)
                .reasoning(reasons.isEmpty() ? "Definition is complete" : String.join("; ", reasons))
                .suggestion(suggestionFor(nodeType, empty, generic, undocumented, attributeCount))
                .standardReference(standardReference)
                .build();
    }

    private String suggestionFor(NodeType nodeType, boolean empty, boolean generic,
                                 List<String> undocumented, int attributeCount) {
        String id = nodeType.getSpecNodeId();
        if (empty) {
            return "Clarify description of " + id + ": describe what the node type represents";
        }
        if (generic) {
            return "Clarify description of " + id + ": replace the generic description with its purpose";
        }
        if (attributeCount == 0) {
            return "Add attribute 'name' to " + id;
        }
        if (!undocumented.isEmpty()) {
            return "Clarify attribute documentation of " + id + ": " + String.join(", ", undocumented);
        }
        return "No change required for " + id;
    }

    boolean isGeneric(NodeType nodeType, String description) {
        String lower = description.toLowerCase(Locale.ROOT);
        if (PLACEHOLDER.matcher(lower).matches()) {
            return true;
        }
        if (nodeType.getTitle() != null && lower.equals(nodeType.getTitle().toLowerCase(Locale.ROOT))) {
            return true;
        }
        Set<String> remaining = new TreeSet<>(TextSimilarity.tokens(description));
        remaining.removeAll(GENERIC_VOCABULARY);
        remaining.removeAll(TextSimilarity.tokens(nodeType.getType()));
        remaining.removeAll(TextSimilarity.tokens(nodeType.getLayerId()));
        return remaining.isEmpty();
    }

    // ========================= OVERLAPS =========================

    /**
     * Pairs of node types in one layer with overlapping names and descriptions.
     */
    public List<OverlapCandidate> detectOverlaps(SchemaGraph graph) {
        List<OverlapCandidate> overlaps = new ArrayList<>();
        for (Layer layer : graph.getLayers()) {
            List<NodeType> nodeTypes = graph.nodeTypesInLayer(layer.getId());
            for (int i = 0; i < nodeTypes.size(); i++) {
                for (int j = i + 1; j < nodeTypes.size(); j++) {
                    overlap(layer, nodeTypes.get(i), nodeTypes.get(j)).ifPresent(overlaps::add);
                }
            }
        }
        log.info("Overlap detection found {} candidates", overlaps.size());
        return overlaps;
    }

    private Optional<OverlapCandidate> overlap(Layer layer, NodeType a, NodeType b) {
        double nameSimilarity = TextSimilarity.jaccard(singular(a.getType()), singular(b.getType()));
        double descriptionSimilarity = TextSimilarity.jaccard(a.getDescription(), b.getDescription());
        double score = TextSimilarity.round(0.5 * nameSimilarity + 0.5 * descriptionSimilarity);

        Confidence confidence;
        if (score >= OVERLAP_HIGH) {
            confidence = Confidence.HIGH;
        } else if (score >= OVERLAP_MEDIUM) {
            confidence = Confidence.MEDIUM;
        } else if (score >= OVERLAP_LOW) {
            confidence = Confidence.LOW;
        } else {
            return Optional.empty();
        }

        return Optional.of(OverlapCandidate.builder()
                .layer(layer.getId())
                .nodeTypeA(a.getSpecNodeId())
                .nodeTypeB(b.getSpecNodeId())
                .similarityScore(score)
                .confidence(confidence)
                .alignmentScore(ScoreTable.duplicateAlignment(confidence))
                .reasoning(String.format(Locale.ROOT, "Name similarity %.2f, description similarity %.2f",
                        nameSimilarity, descriptionSimilarity))
                .suggestion("Collapse node type " + b.getSpecNodeId() + " into " + a.getSpecNodeId()
                        + " as an enum value of attribute 'kind'")
                .standardReference(layer.getStandardReference())
                .build());
    }

    private Set<String> singular(String type) {
        return TextSimilarity.tokens(type).stream()
                .map(t -> t.length() > 3 && t.endsWith("s") ? t.substring(0, t.length() - 1) : t)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    // ========================= LAYER ALIGNMENT =========================

    /**
     * Node types without intra-layer relationships whose cross-layer relationships (at least two)
     * all lead into one other layer.
     */
    public List<LayerAlignmentIssue> detectLayerAlignment(SchemaGraph graph) {
        List<LayerAlignmentIssue> issues = new ArrayList<>();
        for (NodeType nodeType : graph.getNodeTypes().values()) {
            String id = nodeType.getSpecNodeId();
            List<RelationshipType> incident = new ArrayList<>(graph.outgoing(id));
            incident.addAll(graph.incoming(id));

            int intra = 0;
            Set<String> otherLayers = new TreeSet<>();
            for (RelationshipType rel : incident) {
                String other = rel.getSourceSpecNodeId().equals(id) ? rel.getDestinationLayer() : rel.getSourceLayer();
                if (other.equals(nodeType.getLayerId())) {
                    intra++;
                } else {
                    otherLayers.add(other);
                }
            }
            int cross = incident.size() - intra;
            if (intra > 0 || cross < 2 || otherLayers.size() != 1) {
                continue;
            }
            String target = otherLayers.iterator().next();
            issues.add(LayerAlignmentIssue.builder()
                    .nodeType(id)
                    .currentLayer(nodeType.getLayerId())
                    .suggestedLayer(target)
                    .intraLayerEdges(intra)
                    .crossLayerEdges(cross)
                    .alignmentScore(Math.max(30, 70 - 10 * cross))
                    .reasoning("All " + cross + " relationships of " + id + " connect to layer " + target)
                    .standardReference(graph.findLayer(target).map(Layer::getStandardReference).orElse(null))
                    .build());
        }
        return issues;
    }

    // ========================= SUMMARIES =========================

    public List<LayerSummary> summarize(SchemaGraph graph, List<DefinitionQualityFinding> quality,
                                        List<OverlapCandidate> overlaps, List<CompletenessIssue> completeness) {
        List<LayerSummary> summaries = new ArrayList<>();
        for (Layer layer : graph.getLayers()) {
            List<DefinitionQualityFinding> layerQuality = quality.stream()
                    .filter(q -> layer.getId().equals(q.getLayer()))
                    .collect(Collectors.toList());
            double average = layerQuality.stream().mapToInt(DefinitionQualityFinding::getQualityScore).average().orElse(0);

            summaries.add(LayerSummary.builder()
                    .layer(layer.getId())
                    .layerNumber(layer.getNumber())
                    .nodeTypeCount(layerQuality.size())
                    .averageQuality(CoverageAnalyzer.round(average))
                    .emptyDescriptions((int) layerQuality.stream().filter(DefinitionQualityFinding::isEmptyDescription).count())
                    .genericDescriptions((int) layerQuality.stream().filter(DefinitionQualityFinding::isGenericDescription).count())
                    .undocumentedAttributes(layerQuality.stream().mapToInt(q -> q.getUndocumentedAttributes().size()).sum())
                    .overlapCount((int) overlaps.stream().filter(o -> layer.getId().equals(o.getLayer())).count())
                    .completenessIssueCount((int) completeness.stream().filter(c -> layer.getId().equals(c.getLayer())).count())
                    .build());
        }
        return summaries;
    }
}
