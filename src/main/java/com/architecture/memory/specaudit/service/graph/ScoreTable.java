package com.architecture.memory.specaudit.service.graph;

import com.architecture.memory.specaudit.dto.finding.Confidence;
import com.architecture.memory.specaudit.dto.finding.Priority;

/**
 * Fixed mapping from priority and confidence tiers to impact and alignment scores.
 * Alignment at or above {@link #CRITICAL_REVIEW_THRESHOLD} routes a finding to critical review.
 */
public final class ScoreTable {

    public static final int CRITICAL_REVIEW_THRESHOLD = 80;

    private ScoreTable() {
    }

    public static int duplicateAlignment(Confidence confidence) {
        return switch (confidence) {
            case HIGH -> 25;
            case MEDIUM -> 55;
            case LOW -> 80;
        };
    }

    public static int gapImpact(Priority priority) {
        return switch (priority) {
            case HIGH -> 85;
            case MEDIUM -> 55;
            case LOW -> 25;
        };
    }

    public static int gapAlignment(Priority priority) {
        return 100 - gapImpact(priority);
    }

    public static boolean isCriticalReview(int alignmentScore) {
        return alignmentScore >= CRITICAL_REVIEW_THRESHOLD;
    }

    /**
     * Maps a free alignment score back to a gap priority tier.
     */
    public static Priority priorityForAlignment(int alignmentScore) {
        if (alignmentScore < 30) {
            return Priority.HIGH;
        }
        if (alignmentScore < 60) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }
}
