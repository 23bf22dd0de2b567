package com.proofmend.core.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LeanOutputAnalyzer - splits checker output into positioned diagnostics.
 *
 * Recognized headers:
 *   a) Lean:  Play.lean:3:7: error: unknown identifier 'Real.log'
 *   b) Lake:  error: ./Play.lean:3:7: unknown identifier 'Real.log'
 *
 * Lines after a header up to the next header belong to that message
 * (goal states, expected/actual types). Lines before the first header are
 * progress noise and dropped. Returns an empty list when nothing matches;
 * the collector then falls back to one synthetic diagnostic.
 */
@Component
public class LeanOutputAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LeanOutputAnalyzer.class);

    // Positions are capped at nine digits so they always fit an int.
    private static final Pattern LEAN_HEADER =
        Pattern.compile("^([^\\s:][^:\\n\\r]*):(\\d{1,9}):(\\d{1,9}):\\s*(error|warning|info):\\s?(.*)$");

    private static final Pattern LAKE_HEADER =
        Pattern.compile("^(error|warning|info):\\s*([^\\s:][^:\\n\\r]*):(\\d{1,9}):(\\d{1,9}):\\s?(.*)$");

    public List<Diagnostic> analyze(String output) {

        List<Diagnostic> diagnostics = new ArrayList<>();
        if (output == null || output.isBlank()) {
            return diagnostics;
        }

        Header current = null;
        StringBuilder body = new StringBuilder();

        for (String line : output.split("\\R")) {
            Header header = parseHeader(line);
            if (header != null) {
                if (current != null) {
                    diagnostics.add(current.toDiagnostic(body));
                }
                current = header;
                body.setLength(0);
                body.append(header.firstLine);
            } else if (current != null) {
                body.append('\n').append(line);
            }
        }
        if (current != null) {
            diagnostics.add(current.toDiagnostic(body));
        }

        log.debug("[Analyzer] Parsed {} positioned diagnostics from {} chars", diagnostics.size(), output.length());
        return diagnostics;
    }

    private Header parseHeader(String line) {
        Matcher lean = LEAN_HEADER.matcher(line);
        if (lean.matches()) {
            return new Header(lean.group(1), Integer.parseInt(lean.group(2)), Integer.parseInt(lean.group(3)),
                    Severity.fromLabel(lean.group(4)), lean.group(5));
        }
        Matcher lake = LAKE_HEADER.matcher(line);
        if (lake.matches()) {
            return new Header(lake.group(2), Integer.parseInt(lake.group(3)), Integer.parseInt(lake.group(4)),
                    Severity.fromLabel(lake.group(1)), lake.group(5));
        }
        return null;
    }

    private static final class Header {
        private final String file;
        private final int line;
        private final int column;
        private final Severity severity;
        private final String firstLine;

        private Header(String file, int line, int column, Severity severity, String firstLine) {
            this.file = file;
            this.line = line;
            this.column = column;
            this.severity = severity;
            this.firstLine = firstLine;
        }

        private Diagnostic toDiagnostic(StringBuilder body) {
            return new Diagnostic(severity, body.toString().strip(), file,
                    new SourcePosition(line, column), DiagnosticKind.COMPILE);
        }
    }
}
