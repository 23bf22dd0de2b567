package com.proofmend.core.diagnostics;

import java.nio.file.Path;
import java.util.List;

/**
 * Checks one file and reports what is wrong with it.
 *
 * Invokes the toolchain on every call. An empty list means the check passed
 * with nothing on stderr; a failed check always yields at least one ERROR.
 */
public interface DiagnosticCollector {

    List<Diagnostic> diagnose(Path file);

    static long countErrors(List<Diagnostic> diagnostics) {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }
}
