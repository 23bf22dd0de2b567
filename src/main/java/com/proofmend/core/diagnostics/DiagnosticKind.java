package com.proofmend.core.diagnostics;

/**
 * Where a diagnostic came from.
 *
 * COMPILE          - reported by the checker for the source itself
 * TOOL_UNAVAILABLE - no check tool could be launched; says nothing about the source
 * TIMEOUT          - the checker did not finish in time
 * LINT             - a placeholder such as {@code sorry} found in a file that otherwise builds
 */
public enum DiagnosticKind {
    COMPILE,
    TOOL_UNAVAILABLE,
    TIMEOUT,
    LINT
}
