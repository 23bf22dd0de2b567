package com.proofmend.core.diagnostics;

public enum Severity {
    ERROR,
    WARNING;

    /** Maps the lowercase label Lean prints ("error", "warning", "info"). Unknown labels are warnings. */
    public static Severity fromLabel(String label) {
        return "error".equalsIgnoreCase(label) ? ERROR : WARNING;
    }
}
