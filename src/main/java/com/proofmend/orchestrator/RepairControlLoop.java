package com.proofmend.orchestrator;

import com.proofmend.core.diagnostics.Diagnostic;
import com.proofmend.core.diagnostics.DiagnosticCollector;
import com.proofmend.core.diagnostics.DiagnosticKind;
import com.proofmend.core.diagnostics.Severity;
import com.proofmend.core.executor.BuildToolchain;
import com.proofmend.core.executor.CommandResult;
import com.proofmend.core.filesystem.FileSystemManager;
import com.proofmend.core.filesystem.FileSystemManager.FileSystemException;
import com.proofmend.core.fix.BeamTrialRunner;
import com.proofmend.core.fix.DeterministicFixEngine;
import com.proofmend.core.fix.Edit;
import com.proofmend.core.fix.TrialResult;
import com.proofmend.core.lint.SourceLinter;
import com.proofmend.core.patch.PatchApplicator;
import com.proofmend.core.snapshot.Snapshot;
import com.proofmend.core.snapshot.SnapshotStore;
import com.proofmend.core.state.LoopMode;
import com.proofmend.core.state.RepairSession;
import com.proofmend.core.state.SessionStatus;
import com.proofmend.llm.PatchOracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * RepairControlLoop - the state machine that drives one repair session.
 *
 * FULL mode, per iteration:
 *   build ─ ok, no marker ─┬─ extensions left → extend, write, re-verify next iteration
 *                          └─ otherwise       → document once (revert on regression), stop OK
 *         ─ failed ────────┬─ deterministic beam accepted → write, next iteration
 *                          └─ oracle repair   → write, next iteration | nothing → STUCK
 *
 * PATCH mode, per iteration:
 *   diagnose → deterministic beam → oracle diff → snapshot, apply (failure → STUCK) → build
 *
 * Every write goes through {@link #writeTarget}, which refreshes the timestamp and snapshots.
 * Never throws: file-system and other unexpected failures end the session as STUCK.
 */
public class RepairControlLoop {

    private static final Logger log = LoggerFactory.getLogger(RepairControlLoop.class);

    private final BuildToolchain         toolchain;
    private final DiagnosticCollector    collector;
    private final DeterministicFixEngine fixEngine;
    private final BeamTrialRunner        trialRunner;
    private final PatchOracle            oracle;
    private final PatchApplicator        patchApplicator;
    private final SnapshotStore          snapshots;
    private final FileSystemManager      fileSystem;
    private final SourceLinter           linter;

    public RepairControlLoop(
            BuildToolchain         toolchain,
            DiagnosticCollector    collector,
            DeterministicFixEngine fixEngine,
            BeamTrialRunner        trialRunner,
            PatchOracle            oracle,
            PatchApplicator        patchApplicator,
            SnapshotStore          snapshots,
            FileSystemManager      fileSystem,
            SourceLinter           linter
    ) {
        this.toolchain       = toolchain;
        this.collector       = collector;
        this.fixEngine       = fixEngine;
        this.trialRunner     = trialRunner;
        this.oracle          = oracle;
        this.patchApplicator = patchApplicator;
        this.snapshots       = snapshots;
        this.fileSystem      = fileSystem;
        this.linter          = linter;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public SessionStatus run(RepairSession session, LoopMode mode) {

        log.info("========== REPAIR LOOP START ({}) ==========", mode);
        log.info("[Loop] {}", session);

        try {
            return mode == LoopMode.PATCH ? runPatchGraph(session) : runFull(session);
        } catch (FileSystemException e) {
            log.error("[Loop] FATAL: file system failure. Aborting session.", e);
            session.markStuck("File system failure: " + e.getMessage());
            return session.getStatus();
        } catch (RuntimeException e) {
            log.error("[Loop] FATAL: unexpected failure. Aborting session.", e);
            session.markStuck("Unexpected failure: " + e);
            return session.getStatus();
        } finally {
            log.info("========== REPAIR LOOP END: {} after {} iteration(s) ==========",
                    session.getStatus(), session.getIteration());
        }
    }

    // =========================================================================
    // FULL MODE
    // =========================================================================

    private SessionStatus runFull(RepairSession session) throws FileSystemException {

        Path target = session.getTargetFile();
        snapshots.save("iter000", fileSystem.readFile(target));

        while (session.hasIterationsLeft()) {

            session.incrementIteration();
            String tag = session.iterationTag();
            log.info("---------- Iteration {} / {} ----------", session.getIteration(), session.getMaxIterations());

            String source = fileSystem.readFile(target);
            CommandResult build = toolchain.build();

            if (build.isToolUnavailable()) {
                session.markStuck("Build toolchain unavailable: " + build.getStderr());
                return session.getStatus();
            }

            boolean disqualified = linter.hasDisqualifyingMarker(source);

            // -----------------------------------------------------------------
            // CLEAN BUILD → extend, or document once and stop
            // -----------------------------------------------------------------
            if (build.isSuccess() && !disqualified) {

                log.info("[Loop] Build OK");
                session.setStatus(SessionStatus.OK);
                session.clearErrors();

                if (session.hasExtensionsLeft()) {
                    session.consumeExtension();
                    log.info("[Loop] Extension step ({} left after this one, theme '{}')",
                            session.getRemainingExtensions(), session.getTheme());

                    Optional<String> extended = oracle.extend(source, session.getTheme());
                    if (extended.isEmpty()) {
                        log.warn("[Loop] Oracle returned no extension; keeping last compiled version");
                        session.stop("Oracle returned no extension");
                        return session.getStatus();
                    }

                    // unverified until the next iteration's build
                    writeTarget(target, extended.get(), tag + "_extend");
                    session.setStatus(SessionStatus.DIRTY);
                    continue;
                }

                if (!session.isDocumented()) {
                    documentOnce(session, source, tag);
                }

                session.stop("No more updates required");
                return session.getStatus();
            }

            // -----------------------------------------------------------------
            // FAILED BUILD → deterministic beam, then oracle repair
            // -----------------------------------------------------------------
            session.setStatus(SessionStatus.DIRTY);

            List<Diagnostic> checkErrors = errorsOnly(collector.diagnose(target));
            if (isToolUnavailable(checkErrors)) {
                session.markStuck("Check toolchain unavailable: " + checkErrors.get(0).getMessage());
                return session.getStatus();
            }

            List<String> errors = render(withFallback(checkErrors, target, source, build, disqualified));
            session.setErrors(errors);
            log.info("[Loop] {} error(s)", errors.size());

            TrialResult trial = tryDeterministic(target, source, checkErrors);
            if (trial.isAccepted()) {
                writeTarget(target, trial.getAcceptedText().orElseThrow(), tag + "_det");
                continue;
            }

            log.info("[Loop] Escalating to oracle repair");
            Optional<String> repaired = oracle.repair(source, errors);
            if (repaired.isEmpty()) {
                session.markStuck("Oracle returned no repair");
                return session.getStatus();
            }

            writeTarget(target, repaired.get(), tag + "_repair");
        }

        log.warn("[Loop] Iteration budget ({}) exhausted with status {}", session.getMaxIterations(), session.getStatus());
        session.stop("Iteration budget exhausted");
        return session.getStatus();
    }

    /**
     * Runs at most once per session. A documented file that no longer builds is
     * replaced by the pre-documentation snapshot, byte for byte.
     */
    private void documentOnce(RepairSession session, String compiled, String tag) throws FileSystemException {

        session.markDocumented();
        Path target = session.getTargetFile();
        Snapshot beforeDocs = snapshots.save(tag + "_predocs", compiled);

        log.info("[Loop] Adding documentation to the compiled file");
        Optional<String> documented = oracle.document(compiled);
        if (documented.isEmpty()) {
            log.info("[Loop] No documentation was produced; keeping compiled file");
            return;
        }

        writeTarget(target, documented.get(), tag + "_docs");

        CommandResult rebuild = toolchain.build();
        if (rebuild.isSuccess()) {
            log.info("[Loop] Documentation kept; build still passes");
            return;
        }

        log.warn("[Loop] Documentation broke the build; reverting to {}", beforeDocs.getLocation().getFileName());
        writeTarget(target, snapshots.read(beforeDocs), tag + "_docs_revert");
    }

    // =========================================================================
    // PATCH MODE
    // =========================================================================

    private SessionStatus runPatchGraph(RepairSession session) throws FileSystemException {

        Path target = session.getTargetFile();
        snapshots.save("iter000", fileSystem.readFile(target));

        while (true) {

            session.incrementIteration();
            String tag = session.iterationTag();
            log.info("---------- Iteration {} / {} ----------", session.getIteration(), session.getMaxIterations());

            // DIAGNOSE
            String source = fileSystem.readFile(target);
            List<Diagnostic> checkErrors = errorsOnly(collector.diagnose(target));
            if (isToolUnavailable(checkErrors)) {
                session.markStuck("Check toolchain unavailable: " + checkErrors.get(0).getMessage());
                return session.getStatus();
            }
            List<Diagnostic> diagnostics = new ArrayList<>(checkErrors);
            if (diagnostics.isEmpty() && linter.hasDisqualifyingMarker(source)) {
                diagnostics.addAll(lintDiagnostics(target, source));
            }
            session.setErrors(render(diagnostics));
            session.setStatus(diagnostics.isEmpty() ? SessionStatus.OK : SessionStatus.DIRTY);

            // DETERMINISTIC
            TrialResult trial = tryDeterministic(target, source, checkErrors);
            if (trial.isAccepted()) {
                writeTarget(target, trial.getAcceptedText().orElseThrow(), tag + "_det");
                session.setErrors(render(errorsOnly(trial.getAcceptedDiagnostics())));
            }

            // PROPOSE
            session.setPendingPatch(null);
            if (!session.getErrors().isEmpty()) {
                oracle.proposePatch(target.getFileName().toString(), session.getErrors())
                        .ifPresent(session::setPendingPatch);
            }

            // APPLY
            String patch = session.getPendingPatch();
            if (patch != null && !patch.isBlank()) {
                snapshots.save(tag + "_prepatch", fileSystem.readFile(target));
                if (!patchApplicator.apply(patch, target.getParent())) {
                    session.markStuck("Patch failed to apply");
                    return session.getStatus();
                }
                fileSystem.touch(target);
                snapshots.save(tag + "_patch", fileSystem.readFile(target));
            }

            // BUILD
            CommandResult build = toolchain.build();
            if (build.isToolUnavailable()) {
                session.markStuck("Build toolchain unavailable: " + build.getStderr());
                return session.getStatus();
            }
            if (build.isSuccess() && !linter.hasDisqualifyingMarker(fileSystem.readFile(target))) {
                session.setStatus(SessionStatus.OK);
                session.clearErrors();
                session.stop("Build OK");
                return session.getStatus();
            }

            session.setStatus(SessionStatus.DIRTY);
            if (!build.getErrorText().isEmpty()) {
                session.setErrors(List.of(build.getErrorText()));
            }

            if (!session.hasIterationsLeft()) {
                log.warn("[Loop] Iteration budget ({}) exhausted", session.getMaxIterations());
                session.stop("Iteration budget exhausted");
                return session.getStatus();
            }
        }
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    /**
     * Runs the beam over fixes for the single-file check errors only. Both the baseline and
     * every candidate are counted by that same check; build output never reaches the fix engine.
     */
    private TrialResult tryDeterministic(Path target, String source, List<Diagnostic> checkErrors)
            throws FileSystemException {

        long baseline = DiagnosticCollector.countErrors(checkErrors);
        if (baseline == 0) {
            return TrialResult.none(0, 0);
        }

        List<Edit> edits = fixEngine.propose(target, source, render(checkErrors));
        if (edits.isEmpty()) {
            return TrialResult.none(baseline, 0);
        }

        TrialResult trial = trialRunner.run(target, source, edits, baseline);
        if (!trial.isAccepted()) {
            log.warn("[Loop] No viable deterministic candidate");
        }
        return trial;
    }

    /**
     * Errors handed to the oracle. Falls back to the build output when the single-file
     * check found nothing, and to lint issues when only a marker failed the source.
     */
    private List<Diagnostic> withFallback(List<Diagnostic> checkErrors, Path target, String source,
                                          CommandResult build, boolean disqualified) {
        if (!checkErrors.isEmpty()) {
            return checkErrors;
        }

        List<Diagnostic> errors = new ArrayList<>();
        if (!build.isSuccess() && !build.getErrorText().isEmpty()) {
            log.info("[Loop] File check is clean but the build failed; using build output as the error");
            errors.add(Diagnostic.error(build.getErrorText()));
        } else if (disqualified) {
            errors.addAll(lintDiagnostics(target, source));
        }
        return errors;
    }

    private List<Diagnostic> lintDiagnostics(Path target, String source) {
        List<String> issues = linter.findIssues(source);
        if (issues.isEmpty()) {
            issues = List.of("contains a disqualifying marker " + linter.getDisqualifyingMarkers());
        }
        return issues.stream()
                .map(issue -> Diagnostic.of(Severity.ERROR,
                        target.toString(), target.getFileName() + " " + issue, DiagnosticKind.LINT))
                .collect(Collectors.toList());
    }

    private static List<Diagnostic> errorsOnly(List<Diagnostic> diagnostics) {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }

    private static boolean isToolUnavailable(List<Diagnostic> diagnostics) {
        return diagnostics.stream().anyMatch(d -> d.getKind() == DiagnosticKind.TOOL_UNAVAILABLE);
    }

    private static List<String> render(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::render).collect(Collectors.toList());
    }

    /**
     * Writes the working file (timestamp refreshed by the file system layer) and snapshots what landed on disk.
     */
    private void writeTarget(Path target, String content, String tag) throws FileSystemException {
        fileSystem.writeFile(target, content);
        snapshots.save(tag, fileSystem.readFile(target));
        log.info("[Loop] Wrote {} ({})", target.getFileName(), tag);
    }
}
