package com.proofmend.cli;

import com.proofmend.core.filesystem.FileSystemManager.FileSystemException;
import com.proofmend.core.state.LoopMode;
import com.proofmend.orchestrator.RepairOrchestrator;
import com.proofmend.orchestrator.RepairReport;
import com.proofmend.orchestrator.RepairRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * {@code proofmend run --file <path>}: one repair session, exit code 0 on OK and 1 otherwise.
 */
@Component
@CommandLine.Command(name = "run", description = "Run the repair loop on one Lean file", mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-f", "--file"}, required = true, description = "Lean file to repair")
    private Path file;

    @CommandLine.Option(names = "--max-iters", defaultValue = "20", description = "Iteration budget (default: ${DEFAULT-VALUE})")
    private int maxIterations;

    @CommandLine.Option(names = "--beam", defaultValue = "3", description = "Deterministic candidates tried per iteration (default: ${DEFAULT-VALUE})")
    private int beam;

    @CommandLine.Option(names = "--updates", defaultValue = "0", description = "Extension cycles after the first clean build (default: ${DEFAULT-VALUE})")
    private int updates;

    @CommandLine.Option(names = "--theme", defaultValue = "", description = "Theme that extensions should follow")
    private String theme;

    @CommandLine.Option(names = "--scratch-branch", negatable = true, defaultValue = "false",
            description = "Create a scratch git branch before editing (default: ${DEFAULT-VALUE})")
    private boolean scratchBranch;

    @CommandLine.Option(names = "--mode", defaultValue = "FULL", description = "Loop shape: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private LoopMode mode;

    private final RepairOrchestrator orchestrator;

    public RunCommand(RepairOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (maxIterations < 1 || beam < 1 || updates < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--max-iters and --beam must be at least 1, --updates must not be negative");
        }
        if (!Files.isRegularFile(file)) {
            err.println("Error: file not found: " + file);
            return 1;
        }

        RepairRequest request = RepairRequest.forFile(file)
                .maxIterations(maxIterations)
                .beam(beam)
                .updates(updates)
                .theme(theme)
                .scratchBranch(scratchBranch)
                .mode(mode)
                .build();

        RepairReport report;
        try {
            report = orchestrator.repair(request);
        } catch (FileSystemException e) {
            log.error("[CLI] Could not set up the run directory", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.println(report.isSuccess() ? "Build OK" : "Stopped without full success");
        out.flush();
        return report.isSuccess() ? 0 : 1;
    }
}
