package com.proofmend.orchestrator;

import com.proofmend.core.diagnostics.LeanOutputAnalyzer;
import com.proofmend.core.diagnostics.ToolchainDiagnosticCollector;
import com.proofmend.core.executor.LakeToolchain;
import com.proofmend.core.executor.LakeToolchainFactory;
import com.proofmend.core.executor.ProjectLayout;
import com.proofmend.core.filesystem.FileSystemManager;
import com.proofmend.core.filesystem.FileSystemManager.FileSystemException;
import com.proofmend.core.fix.AcceptancePolicy;
import com.proofmend.core.fix.BeamTrialRunner;
import com.proofmend.core.fix.DeterministicFixEngine;
import com.proofmend.core.lint.SourceLinter;
import com.proofmend.core.patch.PatchApplicator;
import com.proofmend.core.snapshot.Snapshot;
import com.proofmend.core.snapshot.SnapshotStore;
import com.proofmend.core.state.RepairSession;
import com.proofmend.core.state.SessionStatus;
import com.proofmend.core.vcs.GitBranchIsolator;
import com.proofmend.llm.PatchOracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * RepairOrchestrator - sets up one repair session and hands it to {@link RepairControlLoop}.
 *
 * Per session:
 *   1. Resolve the target and discover the project root
 *   2. Optionally move onto a scratch git branch
 *   3. Open a fresh run directory for snapshots
 *   4. Run the loop
 *   5. Export run.json and log the summary line
 */
@Component
public class RepairOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RepairOrchestrator.class);

    private final LakeToolchainFactory   toolchainFactory;
    private final LeanOutputAnalyzer     outputAnalyzer;
    private final DeterministicFixEngine fixEngine;
    private final PatchOracle            oracle;
    private final PatchApplicator        patchApplicator;
    private final FileSystemManager      fileSystem;
    private final SourceLinter           linter;
    private final GitBranchIsolator      branchIsolator;
    private final RunMetadataWriter      metadataWriter;
    private final Clock                  clock;

    private final AcceptancePolicy acceptancePolicy;
    private final String           runsDirectory;
    private final String           branchPrefix;

    public RepairOrchestrator(
            LakeToolchainFactory   toolchainFactory,
            LeanOutputAnalyzer     outputAnalyzer,
            DeterministicFixEngine fixEngine,
            PatchOracle            oracle,
            PatchApplicator        patchApplicator,
            FileSystemManager      fileSystem,
            SourceLinter           linter,
            GitBranchIsolator      branchIsolator,
            RunMetadataWriter      metadataWriter,
            Clock                  clock,
            @Value("${proofmend.repair.acceptance-policy:BEST_OF_BEAM}") AcceptancePolicy acceptancePolicy,
            @Value("${proofmend.repair.runs-directory:.agent_runs}") String runsDirectory,
            @Value("${proofmend.repair.branch-prefix:agent/run}") String branchPrefix
    ) {
        this.toolchainFactory = toolchainFactory;
        this.outputAnalyzer   = outputAnalyzer;
        this.fixEngine        = fixEngine;
        this.oracle           = oracle;
        this.patchApplicator  = patchApplicator;
        this.fileSystem       = fileSystem;
        this.linter           = linter;
        this.branchIsolator   = branchIsolator;
        this.metadataWriter   = metadataWriter;
        this.clock            = clock;
        this.acceptancePolicy = acceptancePolicy;
        this.runsDirectory    = runsDirectory;
        this.branchPrefix     = branchPrefix;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    /**
     * @throws IllegalArgumentException if the target file does not exist
     * @throws FileSystemException      if the run directory cannot be created
     */
    public RepairReport repair(RepairRequest request) throws FileSystemException {

        Path target = request.getTargetFile().toAbsolutePath().normalize();
        if (!Files.isRegularFile(target)) {
            throw new IllegalArgumentException("File not found: " + target);
        }

        Instant start = Instant.now(clock);
        log.info("========== PROOFMEND START ==========");
        log.info("[Orchestrator] {}", request);
        if (!oracle.isAvailable()) {
            log.warn("[Orchestrator] No oracle configured; only deterministic fixes can be applied");
        }

        ProjectLayout layout = toolchainFactory.discoverLayout(target);
        LakeToolchain toolchain = toolchainFactory.create(layout);

        String branch = null;
        if (request.isScratchBranch()) {
            branch = branchIsolator.isolate(toolchain.getProjectRoot(), branchPrefix).orElse(null);
        }

        SnapshotStore snapshots = SnapshotStore.open(
                fileSystem, layout.getRoot().resolve(runsDirectory), target, clock);

        ToolchainDiagnosticCollector collector = new ToolchainDiagnosticCollector(toolchain, outputAnalyzer);
        BeamTrialRunner trialRunner = new BeamTrialRunner(collector, fileSystem, acceptancePolicy, request.getBeam());

        RepairControlLoop loop = new RepairControlLoop(
                toolchain, collector, fixEngine, trialRunner, oracle,
                patchApplicator, snapshots, fileSystem, linter);

        RepairSession session = new RepairSession(
                target, request.getMaxIterations(), request.getUpdates(), request.getTheme());

        SessionStatus status = loop.run(session, request.getMode());

        List<String> snapshotNames = snapshots.list().stream()
                .map(Snapshot::getLocation)
                .map(p -> p.getFileName().toString())
                .collect(Collectors.toList());

        RepairReport report = new RepairReport(
                target, request.getMode(), status,
                session.getIteration(), session.getMaxIterations(), session.getStopReason(),
                session.getExtensionsUsed(), session.isDocumented(),
                snapshots.getRunDirectory(), snapshotNames, branch,
                Duration.between(start, Instant.now(clock)));

        if (report.isSuccess()) {
            log.info("========== PROOFMEND SUCCESS ==========");
        } else {
            log.warn("========== PROOFMEND STOPPED: {} ({}) ==========", status, session.getStopReason());
        }

        metadataWriter.export(report);
        metadataWriter.logSummary(report);
        return report;
    }
}
