package com.architecture.memory.specaudit.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of the CI threshold gate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdCheckResult {

    @Builder.Default
    private List<String> violations = new ArrayList<>();

    public boolean isPassed() {
        return violations.isEmpty();
    }
}
