package com.architecture.memory.specaudit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Strength {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Strength fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MEDIUM;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
