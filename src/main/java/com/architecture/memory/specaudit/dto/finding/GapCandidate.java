package com.architecture.memory.specaudit.dto.finding;

import com.architecture.memory.specaudit.model.RelationshipType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A proposed relationship type that the graph is missing.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GapCandidate implements Finding {

    public enum Origin {
        TEMPLATE,
        SIMILAR_NODE_TYPE,
        LAYER_HUB,
        EXTERNAL
    }

    private String sourceNodeType;
    private String destinationNodeType;
    private String suggestedPredicate;
    private String reason;
    private Priority priority;
    private String standardReference;
    private int impactScore;
    private int alignmentScore;

    @Builder.Default
    private Origin origin = Origin.TEMPLATE;

    public String key() {
        return RelationshipType.tripleKey(sourceNodeType, suggestedPredicate, destinationNodeType);
    }

    @Override
    public FindingType getFindingType() {
        return FindingType.GAP_CANDIDATE;
    }

    @Override
    public String getSubject() {
        return sourceNodeType + " -[" + suggestedPredicate + "]-> " + destinationNodeType;
    }

    @Override
    public String getReasoning() {
        return reason;
    }

    @Override
    public String getSuggestion() {
        return "Create relationship " + sourceNodeType + " " + suggestedPredicate + " " + destinationNodeType;
    }
}
