package com.proofmend.orchestrator;

import com.proofmend.core.state.LoopMode;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of one repair session, as given on the command line.
 */
public final class RepairRequest {

    public static final int DEFAULT_MAX_ITERATIONS = 20;
    public static final int DEFAULT_BEAM = 3;

    private final Path targetFile;
    private final int maxIterations;
    private final int beam;
    private final int updates;
    private final String theme;
    private final boolean scratchBranch;
    private final LoopMode mode;

    private RepairRequest(Builder builder) {
        this.targetFile    = Objects.requireNonNull(builder.targetFile, "targetFile");
        this.maxIterations = builder.maxIterations;
        this.beam          = builder.beam;
        this.updates       = builder.updates;
        this.theme         = builder.theme != null ? builder.theme : "";
        this.scratchBranch = builder.scratchBranch;
        this.mode          = builder.mode != null ? builder.mode : LoopMode.FULL;

        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        if (beam < 1) {
            throw new IllegalArgumentException("beam must be at least 1, got " + beam);
        }
        if (updates < 0) {
            throw new IllegalArgumentException("updates must not be negative, got " + updates);
        }
    }

    public static Builder forFile(Path targetFile) {
        return new Builder(targetFile);
    }

    public Path getTargetFile()     { return targetFile; }
    public int getMaxIterations()   { return maxIterations; }
    public int getBeam()            { return beam; }
    public int getUpdates()         { return updates; }
    public String getTheme()        { return theme; }
    public boolean isScratchBranch() { return scratchBranch; }
    public LoopMode getMode()       { return mode; }

    @Override
    public String toString() {
        return String.format("RepairRequest{file=%s, mode=%s, maxIterations=%d, beam=%d, updates=%d, theme='%s', scratchBranch=%b}",
                targetFile, mode, maxIterations, beam, updates, theme, scratchBranch);
    }

    public static final class Builder {

        private final Path targetFile;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private int beam = DEFAULT_BEAM;
        private int updates = 0;
        private String theme = "";
        private boolean scratchBranch = false;
        private LoopMode mode = LoopMode.FULL;

        private Builder(Path targetFile) {
            this.targetFile = targetFile;
        }

        public Builder maxIterations(int maxIterations) { this.maxIterations = maxIterations; return this; }
        public Builder beam(int beam)                   { this.beam = beam; return this; }
        public Builder updates(int updates)             { this.updates = updates; return this; }
        public Builder theme(String theme)              { this.theme = theme; return this; }
        public Builder scratchBranch(boolean enabled)   { this.scratchBranch = enabled; return this; }
        public Builder mode(LoopMode mode)              { this.mode = mode; return this; }

        public RepairRequest build() {
            return new RepairRequest(this);
        }
    }
}
