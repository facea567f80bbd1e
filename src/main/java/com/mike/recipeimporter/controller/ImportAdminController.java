package com.mike.recipeimporter.controller;

import com.mike.recipeimporter.config.ImporterProperties;
import com.mike.recipeimporter.dto.ImportRequest;
import com.mike.recipeimporter.dto.ImportRunSummary;
import com.mike.recipeimporter.dto.LedgerStats;
import com.mike.recipeimporter.dto.RunMode;
import com.mike.recipeimporter.entity.ImportRun;
import com.mike.recipeimporter.entity.UrlRecord;
import com.mike.recipeimporter.service.importer.ImportRunCoordinator;
import com.mike.recipeimporter.service.ledger.StateLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@RestController
@RequestMapping("/api/import")
@Slf4j
public class ImportAdminController {

    static final int MAX_TRACKED_RUNS = 50;

    private final ImportRunCoordinator coordinator;
    private final StateLedger ledger;
    private final String adminToken;

    /** Most recent manual runs, oldest evicted first. */
    private final Map<String, RunState> runs = Collections.synchronizedMap(new LinkedHashMap<String, RunState>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, RunState> eldest) {
            return size() > MAX_TRACKED_RUNS;
        }
    });

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "import-manual-runner");
        t.setDaemon(true);
        return t;
    });

    public ImportAdminController(ImportRunCoordinator coordinator, StateLedger ledger, ImporterProperties props) {
        this.coordinator = coordinator;
        this.ledger = ledger;
        this.adminToken = props.getAdminToken();
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> runAsync(
            @RequestHeader(value = "X-Admin-Token", required = false) String token,
            @RequestParam(defaultValue = "delta") String mode,
            @RequestParam(defaultValue = "false") boolean dryRun
    ) {
        assertAdmin(token);
        RunMode runMode = RunMode.parse(mode);

        if (coordinator.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "ALREADY_RUNNING"));
        }

        String runId = UUID.randomUUID().toString();
        RunState started = RunState.running(runId);
        runs.put(runId, started);

        executor.submit(() -> {
            try {
                Optional<ImportRunSummary> summary = coordinator.tryRun(
                        new ImportRequest(runMode, dryRun, null, null, null));
                runs.replace(runId, summary
                        .map(started::done)
                        .orElseGet(() -> started.failed("Another run was already active")));
            } catch (Exception e) {
                log.error("ImportAdminController: manual run failed", e);
                runs.replace(runId, started.failed(e.getMessage()));
            }
        });

        return ResponseEntity.accepted().body(Map.of(
                "runId", runId,
                "status", "STARTED"
        ));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel(
            @RequestHeader(value = "X-Admin-Token", required = false) String token
    ) {
        assertAdmin(token);
        boolean cancelled = coordinator.cancelActiveRun();
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunState> getRun(
            @RequestHeader(value = "X-Admin-Token", required = false) String token,
            @PathVariable String runId
    ) {
        assertAdmin(token);
        RunState state = runs.get(runId);
        if (state == null) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(state);
    }

    @GetMapping("/runs/latest")
    public List<ImportRun> latestRuns(
            @RequestHeader(value = "X-Admin-Token", required = false) String token,
            @RequestParam(defaultValue = "20") int limit
    ) {
        assertAdmin(token);
        return ledger.latestRuns(limit);
    }

    @GetMapping("/stats")
    public LedgerStats stats(@RequestHeader(value = "X-Admin-Token", required = false) String token) {
        assertAdmin(token);
        return ledger.stats();
    }

    @GetMapping("/failures")
    public List<UrlRecord> failures(
            @RequestHeader(value = "X-Admin-Token", required = false) String token,
            @RequestParam(defaultValue = "50") int limit
    ) {
        assertAdmin(token);
        return ledger.recentFailures(limit);
    }

    @GetMapping("/queued")
    public List<UrlRecord> queued(@RequestHeader(value = "X-Admin-Token", required = false) String token) {
        assertAdmin(token);
        return ledger.queuedUrls();
    }

    private void assertAdmin(String token) {
        if (adminToken != null && !adminToken.isBlank()) {
            if (token == null || !adminToken.equals(token)) {
                throw new UnauthorizedException();
            }
        }
    }

    @ResponseStatus(code = HttpStatus.UNAUTHORIZED)
    private static class UnauthorizedException extends RuntimeException {}

    public record RunState(
            String runId,
            String status,          // RUNNING / DONE / FAILED
            LocalDateTime startedAt,
            LocalDateTime finishedAt,
            String error,
            ImportRunSummary summary
    ) {
        static RunState running(String id) {
            return new RunState(id, "RUNNING", LocalDateTime.now(), null, null, null);
        }
        RunState done(ImportRunSummary s) {
            return new RunState(runId, "DONE", startedAt, LocalDateTime.now(), null, s);
        }
        RunState failed(String error) {
            return new RunState(runId, "FAILED", startedAt, LocalDateTime.now(), error, null);
        }
    }
}
