package com.architecture.memory.specaudit.dto.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A schema file or layer manifest that could not be fully linked into the graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletenessIssue implements Finding {

    public enum Kind {
        PARSE_ERROR,
        LINK_ERROR,
        MISSING_SCHEMA,
        ORPHANED_SCHEMA,
        UNKNOWN_LAYER,
        DUPLICATE_RELATIONSHIP
    }

    private Kind kind;
    private String layer;
    private String element;
    private String file;
    private String message;
    private String suggestion;
    private int alignmentScore;
    private String standardReference;

    @Override
    public FindingType getFindingType() {
        return FindingType.COMPLETENESS_ISSUE;
    }

    @Override
    public String getSubject() {
        return element != null ? element : file;
    }

    @Override
    public String getReasoning() {
        return message;
    }
}
