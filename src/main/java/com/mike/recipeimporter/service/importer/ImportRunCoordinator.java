package com.mike.recipeimporter.service.importer;

import com.mike.recipeimporter.config.ImporterProperties;
import com.mike.recipeimporter.dto.ImportRequest;
import com.mike.recipeimporter.dto.ImportRunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Allows one import run at a time, whoever starts it (command line, cron, admin endpoint).
 * On context shutdown the active run is cancelled and given a grace period to record its completion.
 */
@Component
@Slf4j
public class ImportRunCoordinator implements ApplicationListener<ContextClosedEvent> {

    private final ImportOrchestrator orchestrator;
    private final int shutdownGraceSeconds;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CancellationToken activeToken;
    private volatile CountDownLatch activeRunFinished = new CountDownLatch(0);

    public ImportRunCoordinator(ImportOrchestrator orchestrator, ImporterProperties props) {
        this.orchestrator = orchestrator;
        this.shutdownGraceSeconds = props.getRunner().getShutdownGraceSeconds();
    }

    /** Empty when another run is active. */
    public Optional<ImportRunSummary> tryRun(ImportRequest request) {
        if (!running.compareAndSet(false, true)) {
            log.info("ImportRunCoordinator: a run is already active, skipping");
            return Optional.empty();
        }
        CancellationToken token = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        activeToken = token;
        activeRunFinished = finished;
        try {
            return Optional.of(orchestrator.run(request, token));
        } finally {
            activeToken = null;
            finished.countDown();
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean cancelActiveRun() {
        CancellationToken token = activeToken;
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        if (!cancelActiveRun()) {
            return;
        }
        log.info("ImportRunCoordinator: shutdown requested, waiting up to {}s for the active run", shutdownGraceSeconds);
        try {
            if (!activeRunFinished.await(shutdownGraceSeconds, TimeUnit.SECONDS)) {
                log.warn("ImportRunCoordinator: active run did not stop within {}s", shutdownGraceSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("ImportRunCoordinator: interrupted while waiting for the active run");
        }
    }
}
