package com.mike.recipeimporter.service.importer;

public enum UrlOutcome {
    IMPORTED,
    IMPORTED_VIA_FALLBACK,
    QUEUED,
    FAILED,
    /** dry run, nothing sent */
    SKIPPED
}
