package com.mike.recipeimporter.bootstrap;

import com.mike.recipeimporter.dto.ImportRequest;
import com.mike.recipeimporter.dto.ImportRunSummary;
import com.mike.recipeimporter.dto.RunMode;
import com.mike.recipeimporter.service.importer.ImportRunCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * One-shot import:
 * {@code --mode=backfill|delta --dry-run --force-url=<url> --force-domain=<d> --reset-domain=<d>}.
 */
@Component
@ConditionalOnProperty(prefix = "recipeimporter.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ImportCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ImportRunCoordinator coordinator;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        ImportRequest request = toRequest(args);
        Optional<ImportRunSummary> summary = coordinator.tryRun(request);
        if (summary.isEmpty()) {
            exitCode = 1;
            return;
        }
        exitCode = summary.get().exitCode();
        log.info("ImportCommandLineRunner: done, exitCode={}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static ImportRequest toRequest(ApplicationArguments args) {
        return new ImportRequest(
                RunMode.parse(optionValue(args, "mode")),
                args.containsOption("dry-run"),
                optionValue(args, "force-url"),
                optionValue(args, "force-domain"),
                optionValue(args, "reset-domain")
        );
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
