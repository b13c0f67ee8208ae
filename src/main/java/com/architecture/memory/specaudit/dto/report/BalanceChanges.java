package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Node types whose relationship count moved toward or away from the middle of their
 * category's target range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceChanges {
    private int outliersBefore;
    private int outliersAfter;

    @Builder.Default
    private List<String> improvements = new ArrayList<>();

    @Builder.Default
    private List<String> regressions = new ArrayList<>();

    // outliers before that are within their target range after
    @Builder.Default
    private List<String> newlyBalanced = new ArrayList<>();
}
