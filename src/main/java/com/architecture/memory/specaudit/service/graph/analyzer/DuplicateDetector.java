package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.dto.finding.Confidence;
import com.architecture.memory.specaudit.dto.finding.DuplicateCandidate;
import com.architecture.memory.specaudit.model.Predicate;
import com.architecture.memory.specaudit.model.RelationshipType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import com.architecture.memory.specaudit.service.graph.ScoreTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Flags relationship types on the same endpoint pair whose predicates overlap.
 *
 * Pairs are always evaluated with the lexicographically smaller id as A, so the result does not
 * depend on which relationship is seen first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DuplicateDetector {

    static final double HIGH_THRESHOLD = 0.75;
    static final double MEDIUM_THRESHOLD = 0.55;
    static final double LOW_THRESHOLD = 0.35;

    private final PredicateSimilarity predicateSimilarity;

    public List<DuplicateCandidate> detect(SchemaGraph graph) {
        Map<String, List<RelationshipType>> byEndpoints = new TreeMap<>();
        for (RelationshipType rel : graph.getRelationships()) {
            byEndpoints.computeIfAbsent(rel.getSourceSpecNodeId() + "->" + rel.getDestinationSpecNodeId(),
                    k -> new ArrayList<>()).add(rel);
        }

        List<DuplicateCandidate> candidates = new ArrayList<>();
        for (List<RelationshipType> group : byEndpoints.values()) {
            if (group.size() < 2) {
                continue;
            }
            List<RelationshipType> sorted = group.stream()
                    .sorted(Comparator.comparing(RelationshipType::getId))
                    .collect(Collectors.toList());
            for (int i = 0; i < sorted.size(); i++) {
                for (int j = i + 1; j < sorted.size(); j++) {
                    evaluate(graph, sorted.get(i), sorted.get(j), sorted.size() - 2).ifPresent(candidates::add);
                }
            }
        }

        log.info("Duplicate detection found {} candidates", candidates.size());
        return candidates;
    }

    /**
     * Scores one pair. Argument order is irrelevant.
     */
    public Optional<DuplicateCandidate> evaluate(SchemaGraph graph, RelationshipType first,
                                                 RelationshipType second, int siblingCount) {
        RelationshipType a = first.getId().compareTo(second.getId()) <= 0 ? first : second;
        RelationshipType b = a == first ? second : first;

        Optional<Predicate> predicateA = graph.getPredicate(a.getPredicate());
        Optional<Predicate> predicateB = graph.getPredicate(b.getPredicate());
        if (predicateA.isEmpty() || predicateB.isEmpty()) {
            return Optional.empty();
        }

        double score = predicateSimilarity.score(predicateA.get(), predicateB.get());
        Optional<Confidence> confidence = confidenceFor(score);
        if (confidence.isEmpty()) {
            log.debug("Predicates {} and {} do not overlap (score {})", a.getPredicate(), b.getPredicate(), score);
            return Optional.empty();
        }

        String reasoning = String.format(Locale.ROOT,
                "Predicates '%s' and '%s' overlap (similarity %.3f)%s; %d other relationship type(s) share this endpoint pair",
                a.getPredicate(), b.getPredicate(), score,
                predicateA.get().isInverseOf(predicateB.get()) ? ", despite being catalog inverses" : "",
                siblingCount);

        return Optional.of(DuplicateCandidate.builder()
                .sourceNodeType(a.getSourceSpecNodeId())
                .destinationNodeType(a.getDestinationSpecNodeId())
                .relationshipA(a.getId())
                .relationshipB(b.getId())
                .predicateA(a.getPredicate())
                .predicateB(b.getPredicate())
                .fileA(a.getSourceFile() != null ? a.getSourceFile().toString() : null)
                .fileB(b.getSourceFile() != null ? b.getSourceFile().toString() : null)
                .confidence(confidence.get())
                .similarityScore(score)
                .siblingCount(siblingCount)
                .alignmentScore(ScoreTable.duplicateAlignment(confidence.get()))
                .reasoning(reasoning)
                .standardReference(graph.findLayer(a.getSourceLayer()).map(l -> l.getStandardReference()).orElse(null))
                .build());
    }

    static Optional<Confidence> confidenceFor(double score) {
        if (score >= HIGH_THRESHOLD) {
            return Optional.of(Confidence.HIGH);
        }
        if (score >= MEDIUM_THRESHOLD) {
            return Optional.of(Confidence.MEDIUM);
        }
        if (score >= LOW_THRESHOLD) {
            return Optional.of(Confidence.LOW);
        }
        return Optional.empty();
    }
}
