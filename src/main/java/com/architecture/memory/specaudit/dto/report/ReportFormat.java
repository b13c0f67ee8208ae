package com.architecture.memory.specaudit.dto.report;

import java.util.Locale;

public enum ReportFormat {
    JSON("json"),
    MARKDOWN("md"),
    TEXT("txt");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static ReportFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return TEXT;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "markdown", "md" -> MARKDOWN;
            case "text", "txt" -> TEXT;
            default -> throw new IllegalArgumentException("Unsupported report format: " + name);
        };
    }
}
