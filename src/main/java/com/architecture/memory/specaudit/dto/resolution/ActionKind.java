package com.architecture.memory.specaudit.dto.resolution;

/**
 * Closed set of remediation actions a suggestion can be classified into.
 */
public enum ActionKind {
    MOVE(Effort.HIGH),
    ENUM_COLLAPSE(Effort.MEDIUM),
    REMOVE(Effort.MEDIUM),
    CLARIFY(Effort.LOW),
    ADD_ATTRIBUTE(Effort.LOW),
    CREATE_RELATIONSHIP(Effort.LOW),
    REMOVE_DUPLICATE(Effort.LOW),
    OTHER(Effort.HIGH);

    public enum Effort {
        LOW,
        MEDIUM,
        HIGH
    }

    private final Effort effort;

    ActionKind(Effort effort) {
        this.effort = effort;
    }

    public Effort getEffort() {
        return effort;
    }
}
