package com.architecture.memory.specaudit.dto.recommendation;

import com.architecture.memory.specaudit.dto.finding.Priority;
import com.architecture.memory.specaudit.model.RelationshipType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One relationship proposed by the external recommendation source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRecord {

    private String sourceNodeType;
    private String destinationNodeType;
    private String predicate;
    private String justification;
    private Priority priority;
    private String standardReference;
    private int impactScore;
    private int alignmentScore;

    public String key() {
        return RelationshipType.tripleKey(sourceNodeType, predicate, destinationNodeType);
    }
}
