package com.proofmend.core.fix;

import com.proofmend.core.diagnostics.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one beam trial: the accepted edit and text, if any, with the
 * error counts before and after.
 */
public final class TrialResult {

    private final Edit acceptedEdit;
    private final String acceptedText;
    private final long baselineErrors;
    private final long acceptedErrors;
    private final List<Diagnostic> acceptedDiagnostics;
    private final int candidatesTried;

    private TrialResult(Edit acceptedEdit, String acceptedText, long baselineErrors, long acceptedErrors,
                        List<Diagnostic> acceptedDiagnostics, int candidatesTried) {
        this.acceptedEdit = acceptedEdit;
        this.acceptedText = acceptedText;
        this.baselineErrors = baselineErrors;
        this.acceptedErrors = acceptedErrors;
        this.acceptedDiagnostics = List.copyOf(acceptedDiagnostics);
        this.candidatesTried = candidatesTried;
    }

    public static TrialResult accepted(Edit edit, String text, long baselineErrors,
                                       List<Diagnostic> diagnostics, int candidatesTried) {
        long errors = diagnostics.stream().filter(Diagnostic::isError).count();
        return new TrialResult(edit, text, baselineErrors, errors, diagnostics, candidatesTried);
    }

    public static TrialResult none(long baselineErrors, int candidatesTried) {
        return new TrialResult(null, null, baselineErrors, baselineErrors, List.of(), candidatesTried);
    }

    public boolean isAccepted() {
        return acceptedEdit != null;
    }

    public Optional<Edit> getAcceptedEdit() {
        return Optional.ofNullable(acceptedEdit);
    }

    public Optional<String> getAcceptedText() {
        return Optional.ofNullable(acceptedText);
    }

    public long getBaselineErrors() {
        return baselineErrors;
    }

    public long getAcceptedErrors() {
        return acceptedErrors;
    }

    /** Diagnostics observed with the accepted text on disk; empty when nothing was accepted. */
    public List<Diagnostic> getAcceptedDiagnostics() {
        return acceptedDiagnostics;
    }

    public int getCandidatesTried() {
        return candidatesTried;
    }

    @Override
    public String toString() {
        return isAccepted()
                ? String.format("TrialResult{accepted='%s', errors %d -> %d, tried=%d}",
                        acceptedEdit.getRationale(), baselineErrors, acceptedErrors, candidatesTried)
                : String.format("TrialResult{none, baseline=%d, tried=%d}", baselineErrors, candidatesTried);
    }
}
