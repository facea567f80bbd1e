package com.mike.recipeimporter.bootstrap;

import com.mike.recipeimporter.config.ImporterConfigurationException;
import com.mike.recipeimporter.dto.ImportRequest;
import com.mike.recipeimporter.dto.ImportRunSummary;
import com.mike.recipeimporter.dto.RunMode;
import com.mike.recipeimporter.service.importer.ImportRunCoordinator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ImportCommandLineRunnerTest {

    @Nested
    @DisplayName("toRequest")
    class ToRequest {

        @Test
        @DisplayName("no arguments -> delta, not dry run, no overrides")
        void defaults() {
            ImportRequest request = ImportCommandLineRunner.toRequest(new DefaultApplicationArguments());

            assertEquals(RunMode.DELTA, request.mode());
            assertFalse(request.dryRun());
            assertFalse(request.hasForceUrl());
            assertFalse(request.hasForceDomain());
            assertFalse(request.hasResetDomain());
        }

        @Test
        @DisplayName("all options parsed")
        void all_options() {
            //Arrange
            var args = new DefaultApplicationArguments(
                    "--mode=backfill", "--dry-run",
                    "--force-url=https://example.com/cake",
                    "--force-domain=example.com",
                    "--reset-domain=other.com");
            //Act
            ImportRequest request = ImportCommandLineRunner.toRequest(args);
            //Assert
            assertEquals(RunMode.BACKFILL, request.mode());
            assertTrue(request.dryRun());
            assertEquals("https://example.com/cake", request.forceUrl());
            assertEquals("example.com", request.forceDomain());
            assertEquals("other.com", request.resetDomain());
        }

        @Test
        @DisplayName("'monthly' is accepted as delta")
        void monthly_alias() {
            assertEquals(RunMode.DELTA,
                    ImportCommandLineRunner.toRequest(new DefaultApplicationArguments("--mode=monthly")).mode());
        }

        @Test
        @DisplayName("unknown mode -> configuration error")
        void unknown_mode() {
            assertThrows(ImporterConfigurationException.class,
                    () -> ImportCommandLineRunner.toRequest(new DefaultApplicationArguments("--mode=weekly")));
        }

        @Test
        @DisplayName("blank option value counts as absent")
        void blank_value() {
            assertFalse(ImportCommandLineRunner.toRequest(new DefaultApplicationArguments("--force-url=")).hasForceUrl());
        }
    }

    @Nested
    @DisplayName("exit code")
    class ExitCode {

        @Test
        @DisplayName("exit code follows the run summary")
        void from_summary() {
            //Arrange
            ImportRunCoordinator coordinator = mock(ImportRunCoordinator.class);
            when(coordinator.tryRun(any())).thenReturn(Optional.of(ImportRunSummary.builder()
                    .runId(1L).mode(RunMode.DELTA).failed(2).build()));
            ImportCommandLineRunner runner = new ImportCommandLineRunner(coordinator);
            //Act
            runner.run(new DefaultApplicationArguments());
            //Assert
            assertEquals(1, runner.getExitCode());
        }

        @Test
        @DisplayName("successful run -> 0")
        void success() {
            ImportRunCoordinator coordinator = mock(ImportRunCoordinator.class);
            when(coordinator.tryRun(any())).thenReturn(Optional.of(ImportRunSummary.builder()
                    .runId(1L).mode(RunMode.DELTA).imported(3).build()));
            ImportCommandLineRunner runner = new ImportCommandLineRunner(coordinator);

            runner.run(new DefaultApplicationArguments());

            assertEquals(0, runner.getExitCode());
        }

        @Test
        @DisplayName("another run active -> 1")
        void busy() {
            ImportRunCoordinator coordinator = mock(ImportRunCoordinator.class);
            when(coordinator.tryRun(any())).thenReturn(Optional.empty());
            ImportCommandLineRunner runner = new ImportCommandLineRunner(coordinator);

            runner.run(new DefaultApplicationArguments());

            assertEquals(1, runner.getExitCode());
        }
    }
}
