package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Duplicate pairs eliminated, introduced and kept between two audits. Pairs are keyed by
 * their two relationship ids, independent of order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateChanges {
    private int duplicatesBefore;
    private int duplicatesAfter;

    @Builder.Default
    private List<String> resolved = new ArrayList<>();

    @Builder.Default
    private List<String> newDuplicates = new ArrayList<>();

    @Builder.Default
    private List<String> persistent = new ArrayList<>();

    // resolved / before, as a percentage
    private double eliminationRate;
}
