package com.architecture.memory.specaudit.dto.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node type whose relationship count is an outlier against its layer median.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceIssue implements Finding {

    public enum Status {
        UNDER,
        OVER
    }

    public enum Category {
        STRUCTURAL,
        BEHAVIORAL,
        ENUMERATION,
        REFERENCE
    }

    private String layer;
    private String nodeType;
    private int relationshipCount;
    private double layerMedian;
    private Status status;
    private Category category;
    private int targetMin;
    private int targetMax;
    private int alignmentScore;
    private String reasoning;
    private String standardReference;

    @Override
    public FindingType getFindingType() {
        return FindingType.BALANCE_ISSUE;
    }

    @Override
    public String getSubject() {
        return nodeType;
    }

    @Override
    public String getSuggestion() {
        if (status == Status.OVER) {
            return "Review relationships of " + nodeType + " for redundant or overly generic edges";
        }
        return "Create relationship types connecting " + nodeType + " to its layer";
    }
}
