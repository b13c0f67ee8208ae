package com.architecture.memory.specaudit.dto.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectivityIssue implements Finding {

    public enum Kind {
        LAYER_DIRECTION_VIOLATION
    }

    private Kind kind;
    private String relationshipId;
    private String sourceNodeType;
    private String destinationNodeType;
    private String sourceLayer;
    private String destinationLayer;
    private int alignmentScore;
    private String reasoning;
    private String standardReference;

    @Override
    public FindingType getFindingType() {
        return FindingType.CONNECTIVITY_ISSUE;
    }

    @Override
    public String getSubject() {
        return relationshipId;
    }

    @Override
    public String getSuggestion() {
        return "Remove relationship " + relationshipId + " or reverse it so that " + destinationLayer
                + " references " + sourceLayer;
    }
}
