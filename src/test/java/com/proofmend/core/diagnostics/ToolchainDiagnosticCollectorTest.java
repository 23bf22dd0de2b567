package com.proofmend.core.diagnostics;

import com.proofmend.core.executor.BuildToolchain;
import com.proofmend.core.executor.CommandResult;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolchainDiagnosticCollectorTest {

    private static final Path FILE = Path.of("/work/Play.lean");

    private static BuildToolchain checkReturning(CommandResult result) {
        return new BuildToolchain() {
            @Override public CommandResult build()               { throw new UnsupportedOperationException(); }
            @Override public CommandResult checkFile(Path file) { return result; }
            @Override public Path getProjectRoot()              { return FILE.getParent(); }
        };
    }

    private static List<Diagnostic> diagnose(CommandResult result) {
        return new ToolchainDiagnosticCollector(checkReturning(result), new LeanOutputAnalyzer()).diagnose(FILE);
    }

    @Test
    void testCleanCheckGivesEmptyList() {
        assertTrue(diagnose(CommandResult.completed(0, "", "", 10)).isEmpty());
    }

    @Test
    void testParsedErrorsAreReturnedIndividually() {
        String stdout = """
            Play.lean:3:7: error: unknown identifier 'Real.log'
            Play.lean:5:0: error: unknown namespace 'Classical'
            """;

        List<Diagnostic> diagnostics = diagnose(CommandResult.completed(1, stdout, "", 10));

        assertEquals(2, DiagnosticCollector.countErrors(diagnostics));
        assertTrue(diagnostics.get(0).render().contains("unknown identifier 'Real.log'"));
    }

    @Test
    void testUnparseableFailureBecomesOneSyntheticError() {
        List<Diagnostic> diagnostics = diagnose(CommandResult.completed(1, "", "lake: configuration error\n", 10));

        assertEquals(1, diagnostics.size());
        Diagnostic d = diagnostics.get(0);
        assertTrue(d.isError());
        assertEquals("lake: configuration error", d.getMessage());
        assertEquals(DiagnosticKind.COMPILE, d.getKind());
    }

    @Test
    void testWarningsOnlyOnFailedRunStillReportAnError() {
        String stdout = "Play.lean:9:0: warning: declaration uses 'sorry'\n";

        List<Diagnostic> diagnostics = diagnose(CommandResult.completed(1, stdout, "", 10));

        assertEquals(1, DiagnosticCollector.countErrors(diagnostics));
        assertEquals(2, diagnostics.size());
    }

    @Test
    void testStderrOnSuccessfulExitIsAWarning() {
        List<Diagnostic> diagnostics = diagnose(CommandResult.completed(0, "", "deprecated option\n", 10));

        assertEquals(1, diagnostics.size());
        assertEquals(Severity.WARNING, diagnostics.get(0).getSeverity());
        assertEquals(0, DiagnosticCollector.countErrors(diagnostics));
    }

    @Test
    void testMissingToolIsDistinctFromCompileError() {
        List<Diagnostic> diagnostics = diagnose(CommandResult.toolUnavailable("No check tool available. Tried: lean"));

        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticKind.TOOL_UNAVAILABLE, diagnostics.get(0).getKind());
        assertTrue(diagnostics.get(0).isError());
    }

    @Test
    void testTimeoutIsReportedAsTimeoutKind() {
        List<Diagnostic> diagnostics = diagnose(CommandResult.timedOut("partial", 60, 60_000));

        assertEquals(DiagnosticKind.TIMEOUT, diagnostics.get(0).getKind());
        assertTrue(diagnostics.get(0).getMessage().contains("TIMEOUT after 60 seconds"));
    }
}
