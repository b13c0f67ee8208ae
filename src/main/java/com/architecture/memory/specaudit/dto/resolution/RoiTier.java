package com.architecture.memory.specaudit.dto.resolution;

public enum RoiTier {
    // high impact, low effort
    QUICK_WIN,
    // high impact, medium or high effort
    MAJOR_PROJECT,
    // low impact, low or medium effort
    FILL_IN,
    // low impact, high effort
    LOW_VALUE
}
