package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.resolution.Disposition;
import lombok.Getter;

/**
 * Result of planning one action: a transaction to apply, or the reason nothing needs to be
 * written.
 */
@Getter
public final class RemediationPlan {

    private final Disposition disposition;
    private final String reasoning;
    private final SchemaTransaction transaction;

    private RemediationPlan(Disposition disposition, String reasoning, SchemaTransaction transaction) {
        this.disposition = disposition;
        this.reasoning = reasoning;
        this.transaction = transaction;
    }

    public static RemediationPlan apply(SchemaTransaction transaction, String reasoning) {
        return new RemediationPlan(Disposition.APPLIED, reasoning, transaction);
    }

    public static RemediationPlan alreadyImplemented(String reasoning) {
        return new RemediationPlan(Disposition.ALREADY_IMPLEMENTED, reasoning, null);
    }

    public static RemediationPlan deferred(String reasoning) {
        return new RemediationPlan(Disposition.DEFERRED, reasoning, null);
    }
}
