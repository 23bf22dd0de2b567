package com.proofmend.core.executor;

/**
 * CommandResult - outcome of one external process invocation.
 *
 * Fields:
 *   - exitCode: process exit code (0 for success). -1 on timeout, -2 when the binary could not be started.
 *   - stdout / stderr: captured separately, never null
 *   - elapsedTimeMs: wall-clock time of the invocation
 *   - outcome: whether the process ran to completion, timed out, or could not be launched at all
 */
public class CommandResult {

    public enum Outcome {
        COMPLETED,
        TIMED_OUT,
        TOOL_UNAVAILABLE
    }

    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final long elapsedTimeMs;
    private final Outcome outcome;

    public CommandResult(int exitCode, String stdout, String stderr, long elapsedTimeMs, Outcome outcome) {
        this.exitCode = exitCode;
        this.stdout = stdout != null ? stdout : "";
        this.stderr = stderr != null ? stderr : "";
        this.elapsedTimeMs = elapsedTimeMs;
        this.outcome = outcome != null ? outcome : Outcome.COMPLETED;
    }

    public static CommandResult completed(int exitCode, String stdout, String stderr, long elapsedTimeMs) {
        return new CommandResult(exitCode, stdout, stderr, elapsedTimeMs, Outcome.COMPLETED);
    }

    public static CommandResult timedOut(String partialOutput, int timeoutSeconds, long elapsedTimeMs) {
        return new CommandResult(-1, partialOutput,
                "TIMEOUT after " + timeoutSeconds + " seconds", elapsedTimeMs, Outcome.TIMED_OUT);
    }

    public static CommandResult toolUnavailable(String message) {
        return new CommandResult(-2, "", message, 0, Outcome.TOOL_UNAVAILABLE);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public long getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * A build or check passes only when the process completed with exit 0.
     * Stderr content is judged by the caller.
     */
    public boolean isSuccess() {
        return outcome == Outcome.COMPLETED && exitCode == 0;
    }

    public boolean isToolUnavailable() {
        return outcome == Outcome.TOOL_UNAVAILABLE;
    }

    public boolean isTimedOut() {
        return outcome == Outcome.TIMED_OUT;
    }

    /** Stderr when it carries anything, otherwise stdout. */
    public String getErrorText() {
        String err = stderr.strip();
        return err.isEmpty() ? stdout.strip() : err;
    }

    @Override
    public String toString() {
        return String.format(
            "CommandResult{outcome=%s, exitCode=%d, stdoutLen=%d, stderrLen=%d, elapsedMs=%d}",
            outcome,
            exitCode,
            stdout.length(),
            stderr.length(),
            elapsedTimeMs
        );
    }
}
