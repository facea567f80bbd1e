package com.mike.recipeimporter.service.importer;

import com.mike.recipeimporter.config.ImporterProperties;
import com.mike.recipeimporter.dto.ImportRequest;
import com.mike.recipeimporter.dto.ImportRunSummary;
import com.mike.recipeimporter.dto.RecipeSource;
import com.mike.recipeimporter.service.SourceCatalog;
import com.mike.recipeimporter.service.destination.RecipeDestination;
import com.mike.recipeimporter.service.discovery.DiscoveryEngine;
import com.mike.recipeimporter.service.filter.DomainFilter;
import com.mike.recipeimporter.service.filter.UrlNormalizer;
import com.mike.recipeimporter.service.ledger.StateLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One import run: discovery, filtering and dedup per source, then ingestion within the
 * per-site and total caps of the selected mode. Only successful imports count against the total cap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportOrchestrator {

    private final ImporterProperties props;
    private final SourceCatalog catalog;
    private final DiscoveryEngine discovery;
    private final DomainFilter domainFilter;
    private final UrlNormalizer normalizer;
    private final StateLedger ledger;
    private final RecipeDestination destination;
    private final RecipeIngestionService ingestion;
    private final RunSummaryWriter summaryWriter;

    public ImportRunSummary run(ImportRequest request, CancellationToken token) {
        long startedNanos = System.nanoTime();
        RunCounters counters = new RunCounters();
        long runId = ledger.startRun(request.mode());
        String error = null;

        log.info("ImportOrchestrator: run {} started mode={} dryRun={} forceUrl={} forceDomain={} resetDomain={}",
                runId, request.mode().value(), request.dryRun(),
                request.forceUrl(), request.forceDomain(), request.resetDomain());

        try {
            error = execute(request, token, counters);
        } catch (RuntimeException e) {
            error = "Run aborted: " + e.getMessage();
            log.error("ImportOrchestrator: run {} aborted", runId, e);
        } finally {
            try {
                ledger.completeRun(runId, counters.discovered, counters.imported, counters.failed,
                        counters.skipped, error);
            } catch (RuntimeException e) {
                log.error("ImportOrchestrator: cannot record completion of run {}", runId, e);
            }
        }

        ImportRunSummary summary = ImportRunSummary.builder()
                .runId(runId)
                .mode(request.mode())
                .dryRun(request.dryRun())
                .discovered(counters.discovered)
                .filtered(counters.filtered)
                .skipped(counters.skipped)
                .imported(counters.imported)
                .failed(counters.failed)
                .queued(counters.queued)
                .durationSeconds((System.nanoTime() - startedNanos) / 1_000_000_000.0)
                .cancelled(counters.cancelled)
                .error(error)
                .build();

        log.info("ImportOrchestrator: run finished {}", summary.toLogLine());
        summaryWriter.append(summary);
        return summary;
    }

    /** @return run-level error, or null */
    private String execute(ImportRequest request, CancellationToken token, RunCounters counters) {
        if (request.hasResetDomain()) {
            ledger.resetDomain(request.resetDomain());
        }

        if (!destination.isReachable()) {
            log.error("ImportOrchestrator: recipe destination not reachable, aborting");
            return "Failed to connect to recipe destination";
        }

        if (!request.dryRun()) {
            ensureOrganizers();
        }

        if (request.hasForceUrl()) {
            importSingleUrl(request, counters);
            return null;
        }

        if (request.hasForceDomain()) {
            ledger.markDomainForReimport(request.forceDomain());
        }

        ImporterProperties.ModeLimits limits = props.limitsFor(request.mode());
        List<RecipeSource> sources = catalog.enabledSources();
        log.info("ImportOrchestrator: {} sources, perSite={}, totalCap={}",
                sources.size(), limits.getPerSite(), limits.getTotalCap());

        for (RecipeSource source : sources) {
            if (token.isCancellationRequested()) {
                counters.cancelled = true;
                log.info("ImportOrchestrator: cancellation requested, stopping before source={}", source.key());
                break;
            }
            if (counters.imported >= limits.getTotalCap()) {
                log.info("ImportOrchestrator: total cap {} reached", limits.getTotalCap());
                break;
            }
            try {
                processSource(source, request, limits, token, counters);
            } catch (RuntimeException e) {
                log.error("ImportOrchestrator: source={} failed, continuing with next source", source.key(), e);
            }
        }
        return null;
    }

    private void processSource(RecipeSource source,
                               ImportRequest request,
                               ImporterProperties.ModeLimits limits,
                               CancellationToken token,
                               RunCounters counters) {
        log.info("ImportOrchestrator: processing source={} ({})", source.key(), source.name());

        int discoverLimit = limits.getPerSite() * Math.max(1, props.getDiscoveryMultiplier());
        List<String> discovered = discovery.discover(source, discoverLimit);
        counters.discovered += discovered.size();

        List<String> candidates = new ArrayList<>();
        int filtered = 0;
        int alreadyImported = 0;
        for (String url : discovered) {
            if (!domainFilter.isValid(url, source.key())) {
                filtered++;
                continue;
            }
            if (!isForced(url, request) && ledger.isImported(url)) {
                alreadyImported++;
                continue;
            }
            if (props.isRequireRecipeSchema() && !discovery.hasContentSchema(url)) {
                filtered++;
                continue;
            }
            candidates.add(url);
        }
        counters.filtered += filtered;
        counters.skipped += alreadyImported;

        int remainingCap = Math.max(0, limits.getTotalCap() - counters.imported);
        int take = Math.min(Math.min(limits.getPerSite(), remainingCap), candidates.size());
        List<String> selected = candidates.subList(0, take);

        log.info("ImportOrchestrator: source={} discovered={} filtered={} alreadyImported={} selected={}",
                source.key(), discovered.size(), filtered, alreadyImported, selected.size());

        List<String> tags = source.importTags();
        for (String url : selected) {
            if (token.isCancellationRequested()) {
                counters.cancelled = true;
                log.info("ImportOrchestrator: cancellation requested, stopping within source={}", source.key());
                return;
            }
            if (!request.dryRun()) {
                ledger.recordDiscovered(url, source.key());
            }
            counters.record(ingestion.ingest(url, source.key(), tags, source.categories(), request.dryRun()));
        }
    }

    private void importSingleUrl(ImportRequest request, RunCounters counters) {
        String url = normalizer.normalize(request.forceUrl());
        RecipeSource source = catalog.findByHost(normalizer.host(url)).orElse(null);
        String sourceKey = source == null ? "unknown" : source.key();
        List<String> tags = source == null ? List.of() : source.importTags();
        List<String> categories = source == null ? List.of() : source.categories();

        log.info("ImportOrchestrator: forced import url={} source={}", url, sourceKey);
        counters.discovered = 1;
        UrlOutcome outcome = ingestion.ingest(url, sourceKey, tags, categories, request.dryRun());
        counters.record(outcome);
        log.info("ImportOrchestrator: forced import url={} outcome={}", url, outcome);
    }

    private boolean isForced(String url, ImportRequest request) {
        if (!request.hasForceDomain()) {
            return false;
        }
        return normalizer.hostWithoutWww(url).contains(request.forceDomain().trim().toLowerCase(Locale.ROOT));
    }

    private void ensureOrganizers() {
        for (RecipeSource source : catalog.enabledSources()) {
            destination.ensureTag(source.sourceTag());
            source.tags().forEach(destination::ensureTag);
            source.categories().forEach(destination::ensureCategory);
        }
        log.info("ImportOrchestrator: organizers ensured for {} sources", catalog.enabledSources().size());
    }
}
