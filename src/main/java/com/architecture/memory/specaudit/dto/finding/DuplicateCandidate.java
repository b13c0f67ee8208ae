package com.architecture.memory.specaudit.dto.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two relationship types on the same endpoint pair whose predicates overlap.
 * A is always the relationship with the lexicographically smaller id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateCandidate implements Finding {

    private String sourceNodeType;
    private String destinationNodeType;
    private String relationshipA;
    private String relationshipB;
    private String predicateA;
    private String predicateB;
    private String fileA;
    private String fileB;
    private Confidence confidence;
    private double similarityScore;

    // Other relationship types already on this endpoint pair; context for the reviewer only
    private int siblingCount;

    private int alignmentScore;
    private String reasoning;
    private String standardReference;

    @Override
    public FindingType getFindingType() {
        return FindingType.DUPLICATE_CANDIDATE;
    }

    @Override
    public String getSubject() {
        return relationshipA + " ~ " + relationshipB;
    }

    @Override
    public String getSuggestion() {
        return "Remove duplicate relationship " + relationshipB + " (predicate '" + predicateB
                + "' overlaps '" + predicateA + "')";
    }
}
