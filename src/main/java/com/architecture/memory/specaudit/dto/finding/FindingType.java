package com.architecture.memory.specaudit.dto.finding;

public enum FindingType {
    COVERAGE_METRIC,
    GAP_CANDIDATE,
    DUPLICATE_CANDIDATE,
    BALANCE_ISSUE,
    CONNECTIVITY_ISSUE,
    DEFINITION_QUALITY,
    SEMANTIC_OVERLAP,
    COMPLETENESS_ISSUE,
    LAYER_ALIGNMENT
}
