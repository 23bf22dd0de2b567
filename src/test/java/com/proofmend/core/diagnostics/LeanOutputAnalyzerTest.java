package com.proofmend.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class LeanOutputAnalyzerTest {

    private final LeanOutputAnalyzer analyzer = new LeanOutputAnalyzer();

    @Test
    void testLeanHeaderWithContinuationLines() {
        String output = """
            Play.lean:4:2: error: type mismatch
              rfl
            has type
              1 = 1 : Prop
            Play.lean:9:0: warning: declaration uses 'sorry'
            """;

        List<Diagnostic> diagnostics = analyzer.analyze(output);

        assertEquals(2, diagnostics.size());

        Diagnostic first = diagnostics.get(0);
        assertEquals(Severity.ERROR, first.getSeverity());
        assertEquals("Play.lean", first.getFile().orElseThrow());
        assertEquals(4, first.getPosition().orElseThrow().getLine());
        assertEquals(2, first.getPosition().orElseThrow().getColumn());
        assertTrue(first.getMessage().startsWith("type mismatch"));
        assertTrue(first.getMessage().contains("1 = 1 : Prop"));

        assertEquals(Severity.WARNING, diagnostics.get(1).getSeverity());
    }

    @Test
    void testLakeHeaderFormat() {
        String output = """
            ✖ [3/4] Building Play
            error: ./Play.lean:3:7: unknown identifier 'Real.log'
            error: Lean exited with code 1
            """;

        List<Diagnostic> diagnostics = analyzer.analyze(output);

        assertEquals(1, diagnostics.size());
        Diagnostic d = diagnostics.get(0);
        assertEquals("./Play.lean", d.getFile().orElseThrow());
        assertTrue(d.getMessage().startsWith("unknown identifier 'Real.log'"));
        assertTrue(d.render().contains("unknown identifier 'Real.log'"));
    }

    @Test
    void testOversizedPositionIsNotAHeader() {
        String output = "Play.lean:99999999999:1: error: boom\n"
                + "error: ./Play.lean:1:12345678901: boom\n";

        List<Diagnostic> diagnostics = assertDoesNotThrow(() -> analyzer.analyze(output));

        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testLargestNineDigitPositionStillParses() {
        List<Diagnostic> diagnostics = analyzer.analyze("Play.lean:999999999:0: error: boom\n");

        assertEquals(1, diagnostics.size());
        assertEquals(999999999, diagnostics.get(0).getPosition().orElseThrow().getLine());
    }

    @Test
    void testRenderIgnoresDefaultLocale() {
        Diagnostic d = analyzer.analyze("Play.lean:3:0: warning: declaration uses 'sorry'\n").get(0);
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals("Play.lean:3:0: warning: declaration uses 'sorry'", d.render());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testUnstructuredOutputYieldsNothing() {
        assertTrue(analyzer.analyze("something went wrong\n").isEmpty());
        assertTrue(analyzer.analyze("").isEmpty());
        assertTrue(analyzer.analyze(null).isEmpty());
    }

    @Test
    void testRenderKeepsPositionPrefix() {
        List<Diagnostic> diagnostics = analyzer.analyze("Play.lean:1:0: error: unknown namespace 'Classical'");

        assertEquals("Play.lean:1:0: error: unknown namespace 'Classical'", diagnostics.get(0).render());
    }
}
