package com.proofmend.core.snapshot;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Immutable record of one saved version of the working file.
 * The content lives on disk at {@link #getLocation()}; read it back through the store.
 */
public final class Snapshot {

    private final String tag;
    private final Instant timestamp;
    private final Path location;

    Snapshot(String tag, Instant timestamp, Path location) {
        this.tag = tag;
        this.timestamp = timestamp;
        this.location = location;
    }

    public String getTag() {
        return tag;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Path getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "Snapshot{" + tag + " @ " + timestamp + " -> " + location.getFileName() + "}";
    }
}
