package com.architecture.memory.specaudit.dto.resolution;

/**
 * Sub-queues in processing order. Urgent queues hold findings below the critical-review
 * threshold; critical-review queues hold findings that are already well aligned.
 */
public enum QueueName {
    NODE_URGENT,
    GAP_URGENT,
    DUPLICATE_URGENT,
    NODE_CRITICAL_REVIEW,
    GAP_CRITICAL_REVIEW,
    DUPLICATE_CRITICAL_REVIEW;

    public boolean isCriticalReview() {
        return this == NODE_CRITICAL_REVIEW || this == GAP_CRITICAL_REVIEW || this == DUPLICATE_CRITICAL_REVIEW;
    }
}
