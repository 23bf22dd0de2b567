package com.proofmend.core.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RepairSession - mutable state of one run of the repair loop against one file.
 *
 * Owned exclusively by RepairControlLoop: created when the loop starts, mutated
 * only by it, discarded when it returns. File contents are not kept here; the
 * file on disk is the live version and history is in the snapshot store.
 */
public class RepairSession {

    private static final Logger log = LoggerFactory.getLogger(RepairSession.class);

    private final Path targetFile;
    private final int maxIterations;
    private final String theme;
    private final int extensionBudget;

    private int iteration = 0;
    private SessionStatus status = SessionStatus.DIRTY;
    private List<String> errors = new ArrayList<>();
    private int remainingExtensions;
    private boolean documented = false;
    private String pendingPatch = null;
    private String stopReason = null;

    public RepairSession(Path targetFile, int maxIterations, int extensionBudget, String theme) {
        this.targetFile = targetFile;
        this.maxIterations = Math.max(1, maxIterations);
        this.extensionBudget = Math.max(0, extensionBudget);
        this.remainingExtensions = this.extensionBudget;
        this.theme = theme != null ? theme : "";
    }

    // =========================================================================
    // Iterations
    // =========================================================================

    public int incrementIteration() {
        return ++iteration;
    }

    public boolean hasIterationsLeft() {
        return iteration < maxIterations;
    }

    public int getIteration() { return iteration; }

    public int getMaxIterations() { return maxIterations; }

    /** Snapshot tag prefix for the current iteration, e.g. {@code iter003}. */
    public String iterationTag() {
        return String.format("iter%03d", iteration);
    }

    // =========================================================================
    // Status
    // =========================================================================

    public SessionStatus getStatus() { return status; }

    public void setStatus(SessionStatus status) {
        if (this.status != status) {
            log.info("[Session] Status: {} → {}", this.status, status);
            this.status = status;
        }
    }

    /** Moves to STUCK and records why. */
    public void markStuck(String reason) {
        setStatus(SessionStatus.STUCK);
        stop(reason);
    }

    public void stop(String reason) {
        this.stopReason = reason;
    }

    public String getStopReason() { return stopReason; }

    // =========================================================================
    // Errors
    // =========================================================================

    public List<String> getErrors() { return Collections.unmodifiableList(errors); }

    public void setErrors(List<String> errors) {
        this.errors = new ArrayList<>(errors);
    }

    public void clearErrors() {
        this.errors = new ArrayList<>();
    }

    // =========================================================================
    // Extension and documentation phases
    // =========================================================================

    public boolean hasExtensionsLeft() { return remainingExtensions > 0; }

    public void consumeExtension() {
        if (remainingExtensions <= 0) {
            throw new IllegalStateException("No extension cycles left");
        }
        remainingExtensions--;
    }

    public int getRemainingExtensions() { return remainingExtensions; }

    public int getExtensionsUsed() { return extensionBudget - remainingExtensions; }

    public boolean isDocumented() { return documented; }

    public void markDocumented() { this.documented = true; }

    public String getTheme() { return theme; }

    // =========================================================================
    // Patch-graph mode
    // =========================================================================

    public String getPendingPatch() { return pendingPatch; }

    public void setPendingPatch(String pendingPatch) { this.pendingPatch = pendingPatch; }

    public Path getTargetFile() { return targetFile; }

    @Override
    public String toString() {
        return String.format("RepairSession{file=%s, iteration=%d/%d, status=%s, errors=%d, extensionsLeft=%d, documented=%b}",
                targetFile.getFileName(), iteration, maxIterations, status, errors.size(),
                remainingExtensions, documented);
    }
}
