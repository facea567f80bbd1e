package com.mike.recipeimporter.dto;

public record ImportRequest(
        RunMode mode,
        boolean dryRun,
        String forceUrl,
        String forceDomain,
        String resetDomain
) {
    public static ImportRequest of(RunMode mode) {
        return new ImportRequest(mode, false, null, null, null);
    }

    public boolean hasForceUrl() {
        return forceUrl != null && !forceUrl.isBlank();
    }

    public boolean hasForceDomain() {
        return forceDomain != null && !forceDomain.isBlank();
    }

    public boolean hasResetDomain() {
        return resetDomain != null && !resetDomain.isBlank();
    }
}
