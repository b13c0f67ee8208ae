package com.architecture.memory.specaudit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Cardinality {
    ONE_TO_ONE("one-to-one"),
    ONE_TO_MANY("one-to-many"),
    MANY_TO_ONE("many-to-one"),
    MANY_TO_MANY("many-to-many");

    private final String label;

    Cardinality(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Cardinality fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MANY_TO_MANY;
        }
        for (Cardinality cardinality : values()) {
            if (cardinality.label.equalsIgnoreCase(label) || cardinality.name().equalsIgnoreCase(label)) {
                return cardinality;
            }
        }
        throw new IllegalArgumentException("Unknown cardinality: " + label);
    }
}
