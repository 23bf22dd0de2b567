package com.proofmend.core.diagnostics;

import com.proofmend.core.executor.BuildToolchain;
import com.proofmend.core.executor.CommandResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * ToolchainDiagnosticCollector - runs the single-file check and turns the result into diagnostics.
 *
 *   exit 0, stderr blank          -> []
 *   tool missing / timed out      -> one ERROR of kind TOOL_UNAVAILABLE / TIMEOUT
 *   anything else                 -> parsed records, plus one synthetic record carrying
 *                                    the raw text when parsing found no error on a failed run
 */
public class ToolchainDiagnosticCollector implements DiagnosticCollector {

    private static final Logger log = LoggerFactory.getLogger(ToolchainDiagnosticCollector.class);

    private final BuildToolchain toolchain;
    private final LeanOutputAnalyzer analyzer;

    public ToolchainDiagnosticCollector(BuildToolchain toolchain, LeanOutputAnalyzer analyzer) {
        this.toolchain = toolchain;
        this.analyzer = analyzer;
    }

    @Override
    public List<Diagnostic> diagnose(Path file) {

        CommandResult result = toolchain.checkFile(file);
        String fileName = file.toString();

        if (result.isToolUnavailable()) {
            log.error("[Diagnostics] Check tool unavailable for {}", file.getFileName());
            return List.of(Diagnostic.of(Severity.ERROR, fileName, result.getStderr(), DiagnosticKind.TOOL_UNAVAILABLE));
        }

        if (result.isTimedOut()) {
            log.warn("[Diagnostics] Check of {} timed out", file.getFileName());
            return List.of(Diagnostic.of(Severity.ERROR, fileName,
                    result.getStderr() + "\n" + result.getStdout().strip(), DiagnosticKind.TIMEOUT));
        }

        if (result.getExitCode() == 0 && result.getStderr().isBlank()) {
            log.info("[Diagnostics] {} checks clean", file.getFileName());
            return List.of();
        }

        List<Diagnostic> diagnostics = new ArrayList<>(
                analyzer.analyze(result.getStdout() + "\n" + result.getStderr()));

        boolean failed = result.getExitCode() != 0;
        if (diagnostics.isEmpty() || (failed && DiagnosticCollector.countErrors(diagnostics) == 0)) {
            // collapse the raw output into one synthetic record
            Severity severity = failed ? Severity.ERROR : Severity.WARNING;
            diagnostics.add(Diagnostic.of(severity, fileName, result.getErrorText(), DiagnosticKind.COMPILE));
        }

        log.info("[Diagnostics] {}: exit={}, {} diagnostics ({} errors)",
                file.getFileName(), result.getExitCode(), diagnostics.size(),
                DiagnosticCollector.countErrors(diagnostics));
        return diagnostics;
    }
}
