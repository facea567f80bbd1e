package com.mike.recipeimporter.dto;

import com.mike.recipeimporter.config.ImporterConfigurationException;

import java.util.Locale;

public enum RunMode {
    BACKFILL("backfill"),
    DELTA("delta");

    private final String value;

    RunMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Accepts "backfill", "delta" and the legacy alias "monthly" (= delta). */
    public static RunMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DELTA;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "backfill" -> BACKFILL;
            case "delta", "monthly" -> DELTA;
            default -> throw new ImporterConfigurationException(
                    "Unknown run mode '" + raw + "', expected backfill or delta");
        };
    }
}
