package com.proofmend.core.executor;

import java.nio.file.Path;

/**
 * BuildToolchain - the two toolchain operations the repair loop relies on.
 *
 * Neither operation parses structured diagnostics. A nonzero exit or non-empty
 * stderr is a failure and the raw text is handed on as-is.
 */
public interface BuildToolchain {

    /** Whole-project build, e.g. {@code lake build} in the project root. */
    CommandResult build();

    /** Single-file check, e.g. {@code lake env lean --make <file>}. */
    CommandResult checkFile(Path file);

    /** Directory the toolchain runs in. */
    Path getProjectRoot();
}
