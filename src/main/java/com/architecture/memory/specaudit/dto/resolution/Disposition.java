package com.architecture.memory.specaudit.dto.resolution;

public enum Disposition {
    APPLIED,
    ALREADY_IMPLEMENTED,
    SKIPPED,
    CONFLICT,
    DEFERRED
}
