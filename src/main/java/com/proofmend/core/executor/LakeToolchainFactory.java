package com.proofmend.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a {@link LakeToolchain} for the project that owns a target file.
 */
@Component
public class LakeToolchainFactory {

    private static final Logger log = LoggerFactory.getLogger(LakeToolchainFactory.class);

    private final CommandExecutor executor;
    private final List<String> buildCommand;
    private final List<CheckTier> checkTiers;
    private final List<String> projectMarkers;
    private final Duration buildTimeout;
    private final Duration checkTimeout;

    public LakeToolchainFactory(
            CommandExecutor executor,
            @Value("${proofmend.toolchain.build-command:lake build}") String buildCommand,
            @Value("${proofmend.toolchain.check-commands:lake env lean --make,lean --make}") String[] checkCommands,
            @Value("${proofmend.toolchain.project-markers:lakefile.lean,lakefile.toml}") String[] projectMarkers,
            @Value("${proofmend.toolchain.build-timeout:PT20M}") Duration buildTimeout,
            @Value("${proofmend.toolchain.check-timeout:PT60S}") Duration checkTimeout
    ) {
        this.executor = executor;
        this.buildCommand = Arrays.asList(buildCommand.trim().split("\\s+"));
        this.checkTiers = Arrays.stream(checkCommands)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(CheckTier::parse)
                .collect(Collectors.toList());
        this.projectMarkers = Arrays.stream(projectMarkers)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        this.buildTimeout = buildTimeout;
        this.checkTimeout = checkTimeout;

        log.info("[Toolchain] build='{}', check tiers={}, markers={}",
                buildCommand, checkTiers, this.projectMarkers);
    }

    public ProjectLayout discoverLayout(Path targetFile) {
        ProjectLayout layout = ProjectLayout.discover(targetFile, projectMarkers);
        if (layout.getProjectFile().isEmpty()) {
            log.warn("[Toolchain] No project marker {} above {}; using {} as root",
                    projectMarkers, targetFile, layout.getRoot());
        }
        return layout;
    }

    public LakeToolchain create(ProjectLayout layout) {
        return new LakeToolchain(executor, layout, buildCommand, checkTiers, buildTimeout, checkTimeout);
    }
}
