package com.proofmend.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LakeToolchain - runs {@code lake build} and the tiered single-file check for one project.
 *
 * Created per session by {@link LakeToolchainFactory}, because the project root depends
 * on the target file chosen on the command line.
 */
public class LakeToolchain implements BuildToolchain {

    private static final Logger log = LoggerFactory.getLogger(LakeToolchain.class);

    private final CommandExecutor executor;
    private final ProjectLayout layout;
    private final List<String> buildCommand;
    private final List<CheckTier> checkTiers;
    private final Duration buildTimeout;
    private final Duration checkTimeout;

    public LakeToolchain(
            CommandExecutor executor,
            ProjectLayout layout,
            List<String> buildCommand,
            List<CheckTier> checkTiers,
            Duration buildTimeout,
            Duration checkTimeout
    ) {
        if (checkTiers.isEmpty()) {
            throw new IllegalArgumentException("At least one check tier is required");
        }
        this.executor = executor;
        this.layout = layout;
        this.buildCommand = List.copyOf(buildCommand);
        this.checkTiers = List.copyOf(checkTiers);
        this.buildTimeout = buildTimeout;
        this.checkTimeout = checkTimeout;
    }

    @Override
    public CommandResult build() {
        log.info("[Toolchain] Building project at {}", layout.getRoot());
        CommandResult result = executor.execute(buildCommand, layout.getRoot(), buildTimeout);
        if (result.isToolUnavailable()) {
            log.error("[Toolchain] Build tool unavailable: {}", result.getStderr());
        }
        return result;
    }

    @Override
    public CommandResult checkFile(Path file) {
        List<String> unavailable = new ArrayList<>();

        for (int i = 0; i < checkTiers.size(); i++) {
            CheckTier tier = checkTiers.get(i);
            CommandResult result = executor.execute(tier.commandFor(file), layout.getRoot(), checkTimeout);

            if (!result.isToolUnavailable()) {
                if (i > 0) {
                    log.warn("[Toolchain] Checked {} with fallback tier '{}'", file.getFileName(), tier);
                }
                return result;
            }

            unavailable.add(tier.getName() + ": " + result.getStderr());
            if (i + 1 < checkTiers.size()) {
                log.warn("[Toolchain] Check tier '{}' unavailable, falling back to '{}'",
                        tier, checkTiers.get(i + 1));
            }
        }

        log.error("[Toolchain] No check tier could be launched for {}", file);
        return CommandResult.toolUnavailable("No check tool available. Tried: " + String.join("; ", unavailable));
    }

    @Override
    public Path getProjectRoot() {
        return layout.getRoot();
    }
}
