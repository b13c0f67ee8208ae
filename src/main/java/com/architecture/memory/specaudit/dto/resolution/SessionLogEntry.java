package com.architecture.memory.specaudit.dto.resolution;

import com.architecture.memory.specaudit.dto.finding.FindingType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What happened to one queue item, with the reasoning that led there.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionLogEntry {

    private int position;
    private QueueName queue;
    private FindingType findingType;
    private String subject;
    private int alignmentScore;
    private ActionKind actionKind;
    private RoiTier roiTier;
    private ChosenAction.Choice choice;
    private String executedSuggestion;
    private Disposition disposition;
    private String reasoning;
    private Instant timestamp;

    @Builder.Default
    private List<String> filesWritten = new ArrayList<>();

    @Builder.Default
    private List<String> filesDeleted = new ArrayList<>();
}
