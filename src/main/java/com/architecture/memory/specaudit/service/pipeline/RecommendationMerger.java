package com.architecture.memory.specaudit.service.pipeline;

import com.architecture.memory.specaudit.dto.finding.GapCandidate;
import com.architecture.memory.specaudit.dto.finding.Priority;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.RelationshipType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.ScoreTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Folds external recommendations into the gap candidate list, keyed on
 * {@code source|predicate|destination}. Existing candidates win over new ones, so merging the
 * same record again leaves the list unchanged.
 */
@Component
@Slf4j
public class RecommendationMerger {

    public List<GapCandidate> merge(List<GapCandidate> gaps, Collection<RecommendationRecord> records) {
        Map<String, GapCandidate> merged = new LinkedHashMap<>();
        gaps.forEach(g -> merged.putIfAbsent(g.key(), g));
        int added = 0;
        for (RecommendationRecord record : records) {
            if (merged.putIfAbsent(record.key(), toGap(record)) == null) {
                added++;
            }
        }
        log.debug("Merged {} recommendations into {} gap candidates ({} new)", records.size(), gaps.size(), added);
        return new ArrayList<>(merged.values());
    }

    public GapCandidate toGap(RecommendationRecord record) {
        Priority priority = record.getPriority() != null ? record.getPriority() : Priority.MEDIUM;
        return GapCandidate.builder()
                .sourceNodeType(record.getSourceNodeType())
                .destinationNodeType(record.getDestinationNodeType())
                .suggestedPredicate(record.getPredicate())
                .reason(record.getJustification() != null ? record.getJustification() : "Recommended by external review")
                .priority(priority)
                .standardReference(record.getStandardReference())
                .impactScore(ScoreTable.gapImpact(priority))
                .alignmentScore(ScoreTable.gapAlignment(priority))
                .origin(GapCandidate.Origin.EXTERNAL)
                .build();
    }

    /**
     * Records whose endpoints and predicate exist in the graph and whose triple is not there yet.
     */
    public List<RecommendationRecord> acceptable(SchemaGraph graph, Collection<RecommendationRecord> records) {
        List<RecommendationRecord> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RecommendationRecord record : records) {
            if (graph.findNodeType(record.getSourceNodeType()).isEmpty()
                    || graph.findNodeType(record.getDestinationNodeType()).isEmpty()) {
                log.warn("Ignoring recommendation {} with unknown node type", record.key());
                continue;
            }
            if (!graph.getPredicates().isEmpty() && graph.getPredicate(record.getPredicate()).isEmpty()) {
                log.warn("Ignoring recommendation {} with unknown predicate", record.key());
                continue;
            }
            if (graph.hasRelationship(record.getSourceNodeType(), record.getPredicate(), record.getDestinationNodeType())
                    || !seen.add(record.key())) {
                continue;
            }
            accepted.add(record);
        }
        return accepted;
    }

    public RelationshipType toRelationship(SchemaGraph graph, RecommendationRecord record) {
        NodeType source = graph.findNodeType(record.getSourceNodeType()).orElseThrow();
        NodeType destination = graph.findNodeType(record.getDestinationNodeType()).orElseThrow();
        return RelationshipType.builder()
                .id(RelationshipType.compositeId(source.getSpecNodeId(), record.getPredicate(), destination.getSpecNodeId()))
                .sourceSpecNodeId(source.getSpecNodeId())
                .sourceLayer(source.getLayerId())
                .destinationSpecNodeId(destination.getSpecNodeId())
                .destinationLayer(destination.getLayerId())
                .predicate(record.getPredicate())
                .build();
    }
}
