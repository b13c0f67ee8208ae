package com.architecture.memory.specaudit.dto.finding;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Priority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MEDIUM;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
