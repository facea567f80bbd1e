package com.mike.recipeimporter.service.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mike.recipeimporter.config.ImporterProperties;
import com.mike.recipeimporter.dto.ImportRunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Appends one JSON object per run to the summary log, for tools that tail it.
 */
@Component
@Slf4j
public class RunSummaryWriter {

    private final ObjectMapper objectMapper;
    private final String summaryLog;

    public RunSummaryWriter(ObjectMapper objectMapper, ImporterProperties props) {
        this.objectMapper = objectMapper;
        this.summaryLog = props.getSummaryLog();
    }

    public void append(ImportRunSummary summary) {
        if (summaryLog == null || summaryLog.isBlank()) {
            return;
        }

        ObjectNode line = objectMapper.createObjectNode()
                .put("timestamp", Instant.now().toString())
                .put("event", "import_completed");
        line.put("runId", summary.getRunId());
        line.put("mode", summary.getMode() == null ? null : summary.getMode().value());
        line.put("dryRun", summary.isDryRun());
        line.put("discovered", summary.getDiscovered());
        line.put("filtered", summary.getFiltered());
        line.put("skipped", summary.getSkipped());
        line.put("imported", summary.getImported());
        line.put("failed", summary.getFailed());
        line.put("queued", summary.getQueued());
        line.put("durationSeconds", summary.getDurationSeconds());
        line.put("cancelled", summary.isCancelled());
        line.put("error", summary.getError());

        Path path = Path.of(summaryLog);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, objectMapper.writeValueAsString(line) + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("RunSummaryWriter: cannot append to {}: {}", path, e.toString());
        }
    }
}
