package com.mike.recipeimporter.entity;

import java.util.Arrays;

public enum UrlStatus {
    DISCOVERED("discovered"),
    IMPORTED("imported"),
    IMPORTED_VIA_FALLBACK("imported_via_fallback"),
    QUEUED("queued"),
    FAILED("failed");

    private final String dbValue;

    UrlStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isImported() {
        return this == IMPORTED || this == IMPORTED_VIA_FALLBACK;
    }

    public static UrlStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown url status: " + value));
    }
}
