package com.mike.recipeimporter.service.ledger;

import com.mike.recipeimporter.dto.LedgerStats;
import com.mike.recipeimporter.dto.RunMode;
import com.mike.recipeimporter.entity.ImportRun;
import com.mike.recipeimporter.entity.UrlRecord;
import com.mike.recipeimporter.entity.UrlStatus;
import com.mike.recipeimporter.repository.ImportRunRepository;
import com.mike.recipeimporter.repository.UrlRecordRepository;
import com.mike.recipeimporter.service.filter.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Durable record of every url seen and every run. Each public method is one short transaction,
 * so an interrupted run keeps everything recorded up to that point.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StateLedger {

    private static final Set<UrlStatus> DONE = Set.of(UrlStatus.IMPORTED, UrlStatus.IMPORTED_VIA_FALLBACK);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final UrlRecordRepository urlRecordRepository;
    private final ImportRunRepository importRunRepository;
    private final UrlNormalizer normalizer;

    @Transactional(readOnly = true)
    public boolean isImported(String url) {
        return urlRecordRepository.existsByUrlAndStatusInAndReimportFalse(url, DONE);
    }

    /** Inserts a 'discovered' record unless the url is already known. */
    @Transactional
    public void recordDiscovered(String url, String sourceKey) {
        if (urlRecordRepository.existsById(url)) {
            return;
        }
        urlRecordRepository.save(UrlRecord.builder()
                .url(url)
                .domain(normalizer.host(url))
                .sourceKey(sourceKey)
                .discoveredAt(LocalDateTime.now())
                .status(UrlStatus.DISCOVERED)
                .reimport(false)
                .build());
    }

    @Transactional
    public void recordImport(String url,
                             String sourceKey,
                             UrlStatus status,
                             String destinationId,
                             String contentHash,
                             String error) {
        LocalDateTime now = LocalDateTime.now();
        UrlRecord record = urlRecordRepository.findById(url)
                .orElseGet(() -> UrlRecord.builder()
                        .url(url)
                        .domain(normalizer.host(url))
                        .sourceKey(sourceKey)
                        .discoveredAt(now)
                        .build());

        record.setStatus(status);
        record.setLastError(truncate(error));
        if (status.isImported()) {
            record.setImportedAt(now);
        }
        if (destinationId != null) {
            record.setDestinationId(destinationId);
        }
        if (contentHash != null) {
            record.setContentHash(contentHash);
        }
        record.setReimport(false);

        urlRecordRepository.save(record);
    }

    @Transactional
    public int markDomainForReimport(String domain) {
        int count = urlRecordRepository.markForReimport(domain.trim());
        log.info("StateLedger: marked {} urls of domain '{}' for reimport", count, domain);
        return count;
    }

    @Transactional
    public int resetDomain(String domain) {
        int count = urlRecordRepository.deleteByDomainLike(domain.trim());
        log.info("StateLedger: deleted {} urls of domain '{}'", count, domain);
        return count;
    }

    @Transactional
    public long startRun(RunMode mode) {
        ImportRun run = importRunRepository.save(ImportRun.builder()
                .mode(mode.value())
                .startedAt(LocalDateTime.now())
                .build());
        return run.getId();
    }

    @Transactional
    public void completeRun(long runId, int discovered, int imported, int failed, int skipped, String error) {
        ImportRun run = importRunRepository.findById(runId)
                .orElseThrow(() -> new IllegalStateException("Unknown run id " + runId));
        run.setCompletedAt(LocalDateTime.now());
        run.setUrlsDiscovered(discovered);
        run.setUrlsImported(imported);
        run.setUrlsFailed(failed);
        run.setUrlsSkipped(skipped);
        run.setErrorMessage(truncate(error));
        importRunRepository.save(run);
    }

    @Transactional(readOnly = true)
    public LedgerStats stats() {
        List<LedgerStats.DomainCount> topDomains = urlRecordRepository
                .countByDomain(DONE, PageRequest.of(0, 20))
                .stream()
                .map(v -> new LedgerStats.DomainCount(v.getDomain(), v.getImported()))
                .toList();

        return new LedgerStats(
                urlRecordRepository.count(),
                urlRecordRepository.countByStatusIn(DONE),
                urlRecordRepository.countByStatus(UrlStatus.FAILED),
                urlRecordRepository.countByStatus(UrlStatus.QUEUED),
                topDomains,
                importRunRepository.findTopByOrderByStartedAtDescIdDesc().orElse(null)
        );
    }

    @Transactional(readOnly = true)
    public List<UrlRecord> recentFailures(int limit) {
        return urlRecordRepository.findByStatusOrderByDiscoveredAtDesc(
                UrlStatus.FAILED, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<UrlRecord> queuedUrls() {
        return urlRecordRepository.findByStatusOrderByDiscoveredAtDesc(UrlStatus.QUEUED);
    }

    @Transactional(readOnly = true)
    public List<ImportRun> latestRuns(int limit) {
        var pageable = PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "startedAt", "id"));
        return importRunRepository.findAll(pageable).getContent();
    }

    private static String truncate(String s) {
        if (s == null) {
            return null;
        }
        return s.length() <= MAX_ERROR_LENGTH ? s : s.substring(0, MAX_ERROR_LENGTH);
    }
}
