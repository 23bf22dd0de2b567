package com.proofmend.core.diagnostics;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Diagnostic - one problem reported by the toolchain, or synthesized from its raw output.
 *
 * File and position are optional: the collector only guarantees a severity and the text.
 */
public final class Diagnostic {

    private final Severity severity;
    private final String message;
    private final String file;
    private final SourcePosition position;
    private final DiagnosticKind kind;

    public Diagnostic(Severity severity, String message, String file, SourcePosition position, DiagnosticKind kind) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = message != null ? message : "";
        this.file = file;
        this.position = position;
        this.kind = kind != null ? kind : DiagnosticKind.COMPILE;
    }

    public static Diagnostic error(String message) {
        return new Diagnostic(Severity.ERROR, message, null, null, DiagnosticKind.COMPILE);
    }

    public static Diagnostic of(Severity severity, String file, String message, DiagnosticKind kind) {
        return new Diagnostic(severity, message, file, null, kind);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Optional<String> getFile() {
        return Optional.ofNullable(file);
    }

    public Optional<SourcePosition> getPosition() {
        return Optional.ofNullable(position);
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Text handed to the fix engine and the oracle. Positioned diagnostics keep the
     * {@code file:line:col: error:} prefix so signatures match what the checker printed.
     */
    public String render() {
        if (file != null && position != null) {
            return file + ":" + position + ": " + severity.name().toLowerCase(Locale.ROOT) + ": " + message;
        }
        return message;
    }

    @Override
    public String toString() {
        return "Diagnostic{" + severity + "/" + kind
                + (position != null ? " @" + position : "")
                + ", " + (message.length() > 80 ? message.substring(0, 80) + "..." : message) + "}";
    }
}
