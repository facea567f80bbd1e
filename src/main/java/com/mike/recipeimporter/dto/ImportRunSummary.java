package com.mike.recipeimporter.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

@Value
@Builder
public class ImportRunSummary {
    Long runId;
    RunMode mode;
    boolean dryRun;

    int discovered;
    int filtered;
    int skipped;
    int imported;
    int failed;
    int queued;

    double durationSeconds;
    boolean cancelled;

    /** Run-level failure (destination unreachable, unexpected abort). Null when the loop ran through. */
    String error;

    public boolean isSuccessful() {
        return error == null && failed == 0;
    }

    public int exitCode() {
        return isSuccessful() ? 0 : 1;
    }

    public String toLogLine() {
        return "runId=" + runId +
                " mode=" + (mode == null ? null : mode.value()) +
                " dryRun=" + dryRun +
                " discovered=" + discovered +
                " filtered=" + filtered +
                " skipped=" + skipped +
                " imported=" + imported +
                " failed=" + failed +
                " queued=" + queued +
                " durationSeconds=" + String.format(Locale.ROOT, "%.1f", durationSeconds) +
                " cancelled=" + cancelled +
                (error == null ? "" : " error='" + error + "'");
    }
}
