package com.proofmend.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofmend.core.filesystem.FileSystemManager;
import com.proofmend.core.filesystem.FileSystemManager.FileSystemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Writes run.json into the run directory and logs the one-line [Summary] record.
 * Failures here are logged only; they never change the session outcome.
 */
@Component
public class RunMetadataWriter {

    private static final Logger log = LoggerFactory.getLogger(RunMetadataWriter.class);

    public static final String METADATA_FILE = "run.json";

    private final ObjectMapper objectMapper;
    private final FileSystemManager fileSystem;

    public RunMetadataWriter(ObjectMapper objectMapper, FileSystemManager fileSystem) {
        this.objectMapper = objectMapper;
        this.fileSystem = fileSystem;
    }

    public void logSummary(RepairReport report) {
        try {
            log.info("[Summary] {}", objectMapper.writeValueAsString(report.toMap()));
        } catch (JsonProcessingException e) {
            log.error("[Summary] Could not serialize report {}", report, e);
        }
    }

    public void export(RepairReport report) {
        Path metadataPath = report.getRunDirectory().resolve(METADATA_FILE);
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report.toMap());
            fileSystem.writeFile(metadataPath, json + "\n");
            log.info("[Orchestrator] Exported run metadata to {}", metadataPath);
        } catch (JsonProcessingException | FileSystemException e) {
            log.error("[Orchestrator] Failed to export run metadata", e);
        }
    }
}
