package com.architecture.memory.specaudit.dto.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Definition quality score of one node type. The alignment score equals the quality score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefinitionQualityFinding implements Finding {

    private String nodeType;
    private String layer;
    private int qualityScore;
    private boolean emptyDescription;
    private boolean genericDescription;
    private int attributeCount;

    @Builder.Default
    private List<String> undocumentedAttributes = new ArrayList<>();

    private int alignmentScore;
    private String reasoning;
    private String suggestion;
    private String standardReference;

    @Override
    public FindingType getFindingType() {
        return FindingType.DEFINITION_QUALITY;
    }

    @Override
    public String getSubject() {
        return nodeType;
    }
}
