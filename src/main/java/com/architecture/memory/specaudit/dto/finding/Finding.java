package com.architecture.memory.specaudit.dto.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Common view over every analyzer output that can be routed into a resolution queue.
 */
public interface Finding {

    // Implied by the report list holding the finding
    @JsonIgnore
    FindingType getFindingType();

    /**
     * Stable, human-readable identity of what the finding is about.
     */
    String getSubject();

    /**
     * 0-100. Low values are urgent; values at or above 80 go to critical review.
     */
    int getAlignmentScore();

    String getReasoning();

    /**
     * Free-text remediation suggestion, classified into an action kind during resolution.
     */
    String getSuggestion();

    String getStandardReference();
}
