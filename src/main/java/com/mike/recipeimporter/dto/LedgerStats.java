package com.mike.recipeimporter.dto;

import com.mike.recipeimporter.entity.ImportRun;

import java.util.List;

public record LedgerStats(
        long totalUrls,
        long imported,
        long failed,
        long queued,
        List<DomainCount> topDomains,
        ImportRun latestRun
) {
    public record DomainCount(String domain, long imported) {
    }
}
