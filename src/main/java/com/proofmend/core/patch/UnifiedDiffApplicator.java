package com.proofmend.core.patch;

import com.proofmend.core.executor.CommandExecutor;
import com.proofmend.core.executor.CommandResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * UnifiedDiffApplicator - applies a diff with {@code patch -p0 -i <tmpfile>}.
 *
 * The diff goes through a temp file that is always deleted afterwards.
 * Returns false on a nonzero exit, a timeout or a missing {@code patch} binary.
 */
@Component
public class UnifiedDiffApplicator implements PatchApplicator {

    private static final Logger log = LoggerFactory.getLogger(UnifiedDiffApplicator.class);

    private final CommandExecutor executor;
    private final List<String> patchCommand;
    private final Duration timeout;

    public UnifiedDiffApplicator(
            CommandExecutor executor,
            @Value("${proofmend.patch.command:patch -p0 -i}") String patchCommand,
            @Value("${proofmend.patch.timeout:PT60S}") Duration timeout
    ) {
        this.executor = executor;
        this.patchCommand = Arrays.asList(patchCommand.trim().split("\\s+"));
        this.timeout = timeout;
    }

    @Override
    public boolean apply(String diffText, Path targetDirectory) {

        if (diffText == null || diffText.isBlank()) {
            log.warn("[Patch] Empty diff; nothing to apply");
            return false;
        }

        Path patchFile;
        try {
            patchFile = Files.createTempFile("proofmend_", ".patch");
        } catch (IOException e) {
            log.error("[Patch] Failed to create temp patch file: {}", e.getMessage());
            return false;
        }

        try {
            try {
                Files.writeString(patchFile, diffText, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.error("[Patch] Failed to write temp patch file {}: {}", patchFile, e.getMessage());
                return false;
            }

            List<String> command = new ArrayList<>(patchCommand);
            command.add(patchFile.toString());

            CommandResult result = executor.execute(command, targetDirectory, timeout);
            boolean ok = result.isSuccess();
            if (!ok) {
                log.error("[Patch] patch failed ({}):\n{}\n{}", result.getOutcome(),
                        result.getStdout().strip(), result.getStderr().strip());
            } else {
                log.info("[Patch] Applied {} chars of diff in {}", diffText.length(), targetDirectory);
            }
            return ok;

        } finally {
            try {
                Files.deleteIfExists(patchFile);
            } catch (IOException e) {
                log.warn("[Patch] Could not delete temp patch file {}: {}", patchFile, e.getMessage());
            }
        }
    }
}
