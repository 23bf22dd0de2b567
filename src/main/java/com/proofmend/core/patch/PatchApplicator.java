package com.proofmend.core.patch;

import java.nio.file.Path;

/**
 * Applies a unified diff under a directory.
 *
 * No safety guarantee: on failure the tree is left in whatever state the
 * underlying tool left it. Snapshot before calling.
 */
public interface PatchApplicator {

    boolean apply(String diffText, Path targetDirectory);
}
