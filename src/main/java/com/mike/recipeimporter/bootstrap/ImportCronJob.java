package com.mike.recipeimporter.bootstrap;

import com.mike.recipeimporter.dto.ImportRequest;
import com.mike.recipeimporter.dto.RunMode;
import com.mike.recipeimporter.service.importer.ImportRunCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ImportCronJob {

    private final ImportRunCoordinator coordinator;

    @Value("${recipeimporter.cron.enabled:false}")
    private boolean cronEnabled;

    @Scheduled(cron = "${recipeimporter.cron.expression:0 0 4 1 * *}")
    public void run() {
        if (!cronEnabled) {
            log.debug("ImportCronJob: cron disabled, skipping");
            return;
        }
        try {
            coordinator.tryRun(ImportRequest.of(RunMode.DELTA))
                    .ifPresent(summary -> log.info("ImportCronJob: {}", summary.toLogLine()));
        } catch (Exception e) {
            log.error("ImportCronJob: run failed", e);
        }
    }
}
