package com.proofmend.core.fix;

import com.proofmend.core.diagnostics.Diagnostic;
import com.proofmend.core.diagnostics.DiagnosticCollector;
import com.proofmend.core.filesystem.FileSystemManager;
import com.proofmend.core.filesystem.FileSystemManager.FileSystemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * BeamTrialRunner - trial-applies deterministic edits on the real file and keeps the winner.
 *
 * Each candidate is applied to the original text, never on top of another candidate,
 * re-diagnosed, and the original is written back before the next one is tried.
 * The original text is on disk when this returns; the caller writes the accepted text.
 * A candidate is only eligible when its error count is not above the baseline.
 */
public class BeamTrialRunner {

    private static final Logger log = LoggerFactory.getLogger(BeamTrialRunner.class);

    private final DiagnosticCollector collector;
    private final FileSystemManager fileSystem;
    private final AcceptancePolicy policy;
    private final int beam;

    public BeamTrialRunner(DiagnosticCollector collector, FileSystemManager fileSystem,
                           AcceptancePolicy policy, int beam) {
        this.collector = collector;
        this.fileSystem = fileSystem;
        this.policy = policy;
        this.beam = Math.max(1, beam);
    }

    public TrialResult run(Path file, String original, List<Edit> candidates, long baselineErrors)
            throws FileSystemException {

        List<Edit> beamCandidates = candidates.subList(0, Math.min(beam, candidates.size()));

        Edit             bestEdit        = null;
        String           bestText        = null;
        List<Diagnostic> bestDiagnostics = null;
        long             bestErrors      = Long.MAX_VALUE;
        int              tried           = 0;

        try {
            for (Edit edit : beamCandidates) {
                tried++;
                String candidate = edit.applyTo(original);
                fileSystem.writeFile(file, candidate);

                List<Diagnostic> diagnostics = collector.diagnose(file);
                long errors = DiagnosticCollector.countErrors(diagnostics);
                log.info("[Beam] Trying deterministic edit '{}' -> errors: {} (baseline {})",
                        edit.getRationale(), errors, baselineErrors);

                fileSystem.writeFile(file, original);

                if (errors > baselineErrors) {
                    continue;
                }
                if (errors < bestErrors) {
                    bestEdit = edit;
                    bestText = candidate;
                    bestDiagnostics = diagnostics;
                    bestErrors = errors;
                }
                if (policy == AcceptancePolicy.FIRST_NON_WORSENING) {
                    break;
                }
            }
        } catch (FileSystemException | RuntimeException e) {
            restoreQuietly(file, original);
            throw e;
        }

        TrialResult result = bestEdit != null
                ? TrialResult.accepted(bestEdit, bestText, baselineErrors, bestDiagnostics, tried)
                : TrialResult.none(baselineErrors, tried);
        log.info("[Beam] {} ({})", result, policy);
        return result;
    }

    private void restoreQuietly(Path file, String original) {
        try {
            fileSystem.writeFile(file, original);
        } catch (FileSystemException e) {
            log.error("[Beam] Could not restore {} after a failed trial; recover it from the snapshots", file, e);
        }
    }
}
