package com.proofmend.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (lake, lean, patch, git) as blocking calls with a timeout.
 *
 * Never throws: a missing binary, a timeout and an interrupted wait all come back
 * as a {@link CommandResult} with the matching outcome.
 */
@Component
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private static final long STREAM_JOIN_MILLIS = 1000;

    public CommandResult execute(List<String> command, Path workingDirectory, Duration timeout) {

        long startTime = System.currentTimeMillis();
        log.info("[Executor] Executing: {} (in {})", String.join(" ", command), workingDirectory);

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workingDirectory.toFile());
            process = builder.start();
        } catch (IOException e) {
            log.warn("[Executor] Could not start '{}': {}", command.get(0), e.getMessage());
            return CommandResult.toolUnavailable(
                    "Command not available: " + command.get(0) + " (" + e.getMessage() + ")");
        }

        // stdout and stderr stay separate: callers treat non-empty stderr as a failure signal
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread outThread = drain(process.getInputStream(), stdout, "stdout");
        Thread errThread = drain(process.getErrorStream(), stderr, "stderr");

        try {
            long timeoutSeconds = Math.max(1, timeout.toSeconds());
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                log.warn("[Executor] Process timed out after {} seconds", timeoutSeconds);
                return CommandResult.timedOut(snapshotOf(stdout), (int) timeoutSeconds,
                        System.currentTimeMillis() - startTime);
            }

            outThread.join(STREAM_JOIN_MILLIS);
            errThread.join(STREAM_JOIN_MILLIS);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            log.warn("[Executor] Interrupted while waiting for '{}'", command.get(0));
            return CommandResult.timedOut(snapshotOf(stdout), 0, System.currentTimeMillis() - startTime);
        }

        int exitCode = process.exitValue();
        CommandResult result = CommandResult.completed(
                exitCode, snapshotOf(stdout), snapshotOf(stderr), System.currentTimeMillis() - startTime);

        log.info("[Executor] Exit code: {}, stdout: {} chars, stderr: {} chars",
                exitCode, result.getStdout().length(), result.getStderr().length());
        return result;
    }

    private Thread drain(InputStream stream, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader =
                         new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.warn("[Executor] Error reading {}: {}", name, e.getMessage());
            }
        }, "proofmend-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private String snapshotOf(StringBuilder sink) {
        synchronized (sink) {
            return sink.toString();
        }
    }
}
