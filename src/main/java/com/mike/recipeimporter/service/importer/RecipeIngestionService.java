package com.mike.recipeimporter.service.importer;

import com.mike.recipeimporter.entity.UrlStatus;
import com.mike.recipeimporter.service.destination.IngestionResult;
import com.mike.recipeimporter.service.destination.RecipeDestination;
import com.mike.recipeimporter.service.ledger.StateLedger;
import com.mike.recipeimporter.service.politeness.PoliteFetcher;
import com.mike.recipeimporter.util.ContentHash;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Imports one url: first by url, then from the fetched page when the destination's own
 * scraper rejects it. Every attempt ends up in the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeIngestionService {

    private final RecipeDestination destination;
    private final PoliteFetcher fetcher;
    private final StateLedger ledger;

    public UrlOutcome ingest(String url, String sourceKey, List<String> tags, List<String> categories, boolean dryRun) {
        if (dryRun) {
            log.info("RecipeIngestion: [dry-run] would import url={}", url);
            return UrlOutcome.SKIPPED;
        }

        IngestionResult byUrl = destination.createFromUrl(url, tags, categories);
        switch (byUrl.outcome()) {
            case CREATED -> {
                ledger.recordImport(url, sourceKey, UrlStatus.IMPORTED, byUrl.destinationId(), null, null);
                log.info("RecipeIngestion: imported url={} slug={}", url, byUrl.destinationId());
                return UrlOutcome.IMPORTED;
            }
            case ALREADY_EXISTS -> {
                ledger.recordImport(url, sourceKey, UrlStatus.IMPORTED, null, null, null);
                log.info("RecipeIngestion: already on destination url={}", url);
                return UrlOutcome.IMPORTED;
            }
            case QUEUED -> {
                ledger.recordImport(url, sourceKey, UrlStatus.QUEUED, null, null, null);
                log.info("RecipeIngestion: queued by destination url={}", url);
                return UrlOutcome.QUEUED;
            }
            default -> {
                return importFromPage(url, sourceKey, tags, categories, byUrl.reason());
            }
        }
    }

    private UrlOutcome importFromPage(String url, String sourceKey, List<String> tags, List<String> categories,
                                      String urlImportReason) {
        log.info("RecipeIngestion: url import rejected ({}), trying page content url={}", urlImportReason, url);

        Optional<String> html = fetcher.fetchPage(url);
        if (html.isEmpty()) {
            String error = "URL import failed: " + urlImportReason + "; page could not be fetched";
            ledger.recordImport(url, sourceKey, UrlStatus.FAILED, null, null, error);
            log.warn("RecipeIngestion: failed url={} error={}", url, error);
            return UrlOutcome.FAILED;
        }

        IngestionResult byContent = destination.createFromRawContent(url, html.get(), tags, categories);
        if (byContent.isStored()) {
            String hash = ContentHash.shortSha256(html.get());
            ledger.recordImport(url, sourceKey, UrlStatus.IMPORTED_VIA_FALLBACK, byContent.destinationId(), hash, null);
            log.info("RecipeIngestion: imported from page content url={} hash={}", url, hash);
            return UrlOutcome.IMPORTED_VIA_FALLBACK;
        }

        String error = byContent.reason() == null ? "Content import failed" : byContent.reason();
        ledger.recordImport(url, sourceKey, UrlStatus.FAILED, null, null, error);
        log.warn("RecipeIngestion: failed url={} error={}", url, error);
        return UrlOutcome.FAILED;
    }
}
