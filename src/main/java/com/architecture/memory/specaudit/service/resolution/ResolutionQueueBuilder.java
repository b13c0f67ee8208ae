package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.finding.*;
import com.architecture.memory.specaudit.dto.report.AuditReport;
import com.architecture.memory.specaudit.dto.report.LoadedReport;
import com.architecture.memory.specaudit.dto.report.NodeAuditReport;
import com.architecture.memory.specaudit.dto.resolution.ActionKind;
import com.architecture.memory.specaudit.dto.resolution.QueueName;
import com.architecture.memory.specaudit.dto.resolution.ResolutionQueueItem;
import com.architecture.memory.specaudit.model.Predicate;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.ScoreTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Orders the findings of a loaded report into the resolution queue.
 *
 * Node findings, gaps and duplicates each split into an urgent sub-queue (alignment below
 * the critical-review threshold, ascending) and a critical-review sub-queue (descending).
 * Ties break by subject. Coverage metrics describe state and are not queued.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResolutionQueueBuilder {

    private static final Comparator<ResolutionQueueItem> ASCENDING =
            Comparator.comparingInt(ResolutionQueueItem::getAlignmentScore).thenComparing(ResolutionQueueItem::getSubject);
    private static final Comparator<ResolutionQueueItem> DESCENDING =
            Comparator.comparingInt(ResolutionQueueItem::getAlignmentScore).reversed()
                    .thenComparing(ResolutionQueueItem::getSubject);

    private final ActionClassifier actionClassifier;
    private final RoiClassifier roiClassifier;

    /**
     * @param graph live graph, used for the inverse predicates offered as gap alternatives
     */
    public List<ResolutionQueueItem> build(LoadedReport report, SchemaGraph graph) {
        Map<QueueName, List<ResolutionQueueItem>> queues = new EnumMap<>(QueueName.class);
        for (QueueName name : QueueName.values()) {
            queues.put(name, new ArrayList<>());
        }

        if (report.hasNodeAudit()) {
            NodeAuditReport nodeAudit = report.getNodeAudit();
            nodeAudit.getDefinitionQuality().stream()
                    .filter(q -> q.getQualityScore() < 100)
                    .forEach(q -> addNodeFinding(queues, q, null));
            nodeAudit.getOverlaps().forEach(o -> addNodeFinding(queues, o, "Collapse node type " + o.getNodeTypeA()
                    + " into " + o.getNodeTypeB() + " as an enum value of attribute 'kind'"));
            nodeAudit.getCompletenessIssues().forEach(c -> addNodeFinding(queues, c, null));
            nodeAudit.getLayerAlignment().forEach(a -> addNodeFinding(queues, a, null));
        } else {
            AuditReport audit = report.getRelationshipAudit();
            for (GapCandidate gap : audit.getGaps()) {
                QueueName queue = ScoreTable.isCriticalReview(gap.getAlignmentScore())
                        ? QueueName.GAP_CRITICAL_REVIEW : QueueName.GAP_URGENT;
                String inverse = inverseSuggestion(graph, gap);
                queues.get(queue).add(item(queue, gap, inverse));
            }
            for (DuplicateCandidate duplicate : audit.getDuplicates()) {
                QueueName queue = ScoreTable.isCriticalReview(duplicate.getAlignmentScore())
                        ? QueueName.DUPLICATE_CRITICAL_REVIEW : QueueName.DUPLICATE_URGENT;
                queues.get(queue).add(item(queue, duplicate, "Remove duplicate relationship "
                        + duplicate.getRelationshipA() + " (predicate '" + duplicate.getPredicateA()
                        + "' overlaps '" + duplicate.getPredicateB() + "')"));
            }
            if (audit.getBalance() != null) {
                audit.getBalance().getIssues().forEach(b -> addNodeFinding(queues, b, null));
            }
            if (audit.getConnectivity() != null) {
                audit.getConnectivity().getIssues().forEach(c -> addNodeFinding(queues, c, null));
            }
            audit.getCompletenessIssues().forEach(c -> addNodeFinding(queues, c, null));
        }

        List<ResolutionQueueItem> ordered = new ArrayList<>();
        for (QueueName name : QueueName.values()) {
            List<ResolutionQueueItem> queue = queues.get(name);
            queue.sort(name.isCriticalReview() ? DESCENDING : ASCENDING);
            ordered.addAll(queue);
        }
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setPosition(i + 1);
        }

        log.info("Resolution queue built with {} items", ordered.size());
        return ordered;
    }

    private void addNodeFinding(Map<QueueName, List<ResolutionQueueItem>> queues, Finding finding, String alternative) {
        QueueName queue = ScoreTable.isCriticalReview(finding.getAlignmentScore())
                ? QueueName.NODE_CRITICAL_REVIEW : QueueName.NODE_URGENT;
        queues.get(queue).add(item(queue, finding, alternative));
    }

    private ResolutionQueueItem item(QueueName queue, Finding finding, String alternative) {
        ActionKind kind = actionClassifier.classify(finding.getSuggestion());
        int impact = 100 - finding.getAlignmentScore();
        return ResolutionQueueItem.builder()
                .queue(queue)
                .finding(finding)
                .findingType(finding.getFindingType())
                .subject(finding.getSubject() == null ? "" : finding.getSubject())
                .alignmentScore(finding.getAlignmentScore())
                .impactScore(impact)
                .primarySuggestion(finding.getSuggestion())
                .alternativeSuggestion(alternative)
                .actionKind(kind)
                .roiTier(roiClassifier.classify(impact, kind))
                .build();
    }

    private String inverseSuggestion(SchemaGraph graph, GapCandidate gap) {
        if (gap.getSourceNodeType().equals(gap.getDestinationNodeType())) {
            return null;
        }
        return graph.getPredicate(gap.getSuggestedPredicate())
                .map(Predicate::getInverse)
                .filter(inverse -> !inverse.isBlank())
                .map(inverse -> "Create relationship " + gap.getDestinationNodeType() + " " + inverse + " "
                        + gap.getSourceNodeType())
                .orElse(null);
    }
}
