package com.proofmend.core.state;

/**
 * Control shapes of the repair loop.
 *
 * FULL  - build, deterministic beam, full-file oracle repair, then extend and document phases
 * PATCH - diagnose, deterministic beam, oracle diff, apply, build
 */
public enum LoopMode {
    FULL,
    PATCH
}
