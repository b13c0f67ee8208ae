package com.architecture.memory.specaudit.dto.resolution;

import com.architecture.memory.specaudit.dto.finding.Finding;
import com.architecture.memory.specaudit.dto.finding.FindingType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionQueueItem {

    // 1-based position in the processing order
    private int position;
    private QueueName queue;

    @JsonIgnore
    private Finding finding;

    private FindingType findingType;
    private String subject;
    private int alignmentScore;
    private int impactScore;

    private String primarySuggestion;

    // null when the finding has no sensible alternative
    private String alternativeSuggestion;

    private ActionKind actionKind;
    private RoiTier roiTier;

    public boolean hasAlternative() {
        return alternativeSuggestion != null;
    }
}
