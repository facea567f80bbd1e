package com.mike.recipeimporter.service.importer;

import com.mike.recipeimporter.TestFixtures;
import com.mike.recipeimporter.dto.ImportRequest;
import com.mike.recipeimporter.dto.ImportRunSummary;
import com.mike.recipeimporter.dto.RunMode;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ImportRunCoordinatorTest {

    private static ImportRunSummary summary(CancellationToken token) {
        return ImportRunSummary.builder().runId(1L).mode(RunMode.DELTA)
                .cancelled(token.isCancellationRequested()).build();
    }

    @Test
    void single_run_returns_summary() {
        ImportOrchestrator orchestrator = mock(ImportOrchestrator.class);
        when(orchestrator.run(any(), any())).thenAnswer(inv -> summary(inv.getArgument(1)));
        ImportRunCoordinator coordinator = new ImportRunCoordinator(orchestrator, TestFixtures.importerProperties());

        Optional<ImportRunSummary> result = coordinator.tryRun(ImportRequest.of(RunMode.DELTA));

        assertTrue(result.isPresent());
        assertFalse(coordinator.isRunning());
        assertFalse(coordinator.cancelActiveRun());
    }

    @Test
    void second_run_rejected_and_cancel_reaches_active_run() throws Exception {
        //Arrange
        CountDownLatch started = new CountDownLatch(1);
        ImportOrchestrator orchestrator = mock(ImportOrchestrator.class);
        when(orchestrator.run(any(), any())).thenAnswer(inv -> {
            CancellationToken token = inv.getArgument(1);
            started.countDown();
            while (!token.isCancellationRequested()) {
                Thread.sleep(10);
            }
            return summary(token);
        });
        ImportRunCoordinator coordinator = new ImportRunCoordinator(orchestrator, TestFixtures.importerProperties());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<ImportRunSummary>> first = executor.submit(() -> coordinator.tryRun(ImportRequest.of(RunMode.DELTA)));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            //Act
            Optional<ImportRunSummary> second = coordinator.tryRun(ImportRequest.of(RunMode.BACKFILL));
            boolean cancelled = coordinator.cancelActiveRun();

            //Assert
            assertTrue(second.isEmpty());
            assertTrue(cancelled);
            assertTrue(first.get(5, TimeUnit.SECONDS).orElseThrow().isCancelled());
            assertFalse(coordinator.isRunning());
            verify(orchestrator, times(1)).run(any(), any());
        } finally {
            executor.shutdownNow();
        }
    }
}
