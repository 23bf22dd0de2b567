package com.proofmend.orchestrator;

import com.proofmend.core.state.LoopMode;
import com.proofmend.core.state.SessionStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one repair session. Success means the session ended with status OK.
 */
public final class RepairReport {

    private final Path targetFile;
    private final LoopMode mode;
    private final SessionStatus status;
    private final int iterations;
    private final int maxIterations;
    private final String stopReason;
    private final int extensionsUsed;
    private final boolean documented;
    private final Path runDirectory;
    private final List<String> snapshots;
    private final String branch;
    private final Duration elapsed;

    public RepairReport(Path targetFile, LoopMode mode, SessionStatus status, int iterations, int maxIterations,
                        String stopReason, int extensionsUsed, boolean documented, Path runDirectory,
                        List<String> snapshots, String branch, Duration elapsed) {
        this.targetFile     = targetFile;
        this.mode           = mode;
        this.status         = status;
        this.iterations     = iterations;
        this.maxIterations  = maxIterations;
        this.stopReason     = stopReason;
        this.extensionsUsed = extensionsUsed;
        this.documented     = documented;
        this.runDirectory   = runDirectory;
        this.snapshots      = List.copyOf(snapshots);
        this.branch         = branch;
        this.elapsed        = elapsed;
    }

    public boolean isSuccess()          { return status == SessionStatus.OK; }
    public Path getTargetFile()         { return targetFile; }
    public LoopMode getMode()           { return mode; }
    public SessionStatus getStatus()    { return status; }
    public int getIterations()          { return iterations; }
    public int getMaxIterations()       { return maxIterations; }
    public String getStopReason()       { return stopReason; }
    public int getExtensionsUsed()      { return extensionsUsed; }
    public boolean isDocumented()       { return documented; }
    public Path getRunDirectory()       { return runDirectory; }
    public List<String> getSnapshots()  { return snapshots; }
    public Optional<String> getBranch() { return Optional.ofNullable(branch); }
    public Duration getElapsed()        { return elapsed; }

    /** Flat view written to run.json and the summary log line. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", targetFile.toString());
        map.put("mode", mode.name());
        map.put("success", isSuccess());
        map.put("status", status.name());
        map.put("iterations", iterations);
        map.put("max_iterations", maxIterations);
        map.put("stop_reason", stopReason);
        map.put("extensions_used", extensionsUsed);
        map.put("documented", documented);
        map.put("run_directory", runDirectory.toString());
        map.put("snapshots", snapshots);
        map.put("branch", branch);
        map.put("wall_time_seconds", elapsed.toSeconds());
        return map;
    }

    @Override
    public String toString() {
        return String.format("RepairReport{status=%s, iterations=%d/%d, reason='%s'}",
                status, iterations, maxIterations, stopReason);
    }
}
