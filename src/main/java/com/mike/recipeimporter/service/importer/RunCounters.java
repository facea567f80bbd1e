package com.mike.recipeimporter.service.importer;

/** Mutable tallies of one run. */
class RunCounters {

    int discovered;
    int filtered;
    int skipped;
    int imported;
    int failed;
    int queued;
    boolean cancelled;

    void record(UrlOutcome outcome) {
        switch (outcome) {
            case IMPORTED, IMPORTED_VIA_FALLBACK -> imported++;
            case QUEUED -> queued++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
        }
    }
}
