package com.proofmend.core.snapshot;

import com.proofmend.core.filesystem.FileSystemManager;
import com.proofmend.core.filesystem.FileSystemManager.FileSystemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * SnapshotStore - append-only history of the working file for one session.
 *
 * Layout:
 *   <runsRoot>/<yyyyMMdd-HHmmss>[-n]/snapshots/<stem>.<tag><suffix>
 *
 * A run directory is never shared between sessions. Snapshots are never
 * overwritten, pruned or deleted; saving a tag twice fails.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    public static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private static final Pattern UNSAFE_TAG_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final FileSystemManager fileSystem;
    private final Clock clock;
    private final Path runDirectory;
    private final Path snapshotsDirectory;
    private final String stem;
    private final String suffix;
    private final List<Snapshot> snapshots = new ArrayList<>();

    private SnapshotStore(FileSystemManager fileSystem, Clock clock, Path runDirectory,
                          Path snapshotsDirectory, String stem, String suffix) {
        this.fileSystem = fileSystem;
        this.clock = clock;
        this.runDirectory = runDirectory;
        this.snapshotsDirectory = snapshotsDirectory;
        this.stem = stem;
        this.suffix = suffix;
    }

    /**
     * Creates a fresh run directory under {@code runsRoot} for snapshots of {@code targetFile}.
     */
    public static SnapshotStore open(FileSystemManager fileSystem, Path runsRoot, Path targetFile, Clock clock)
            throws FileSystemException {

        String runId = RUN_ID_FORMAT.format(Instant.now(clock).atZone(clock.getZone()));
        Path runDirectory = fileSystem.createUniqueDirectory(runsRoot, runId);
        Path snapshotsDirectory = runDirectory.resolve("snapshots");

        String fileName = targetFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem   = dot > 0 ? fileName.substring(0, dot) : fileName;
        String suffix = dot > 0 ? fileName.substring(dot) : "";

        log.info("[Snapshots] Run directory: {}", runDirectory);
        return new SnapshotStore(fileSystem, clock, runDirectory, snapshotsDirectory, stem, suffix);
    }

    public Snapshot save(String tag, String content) throws FileSystemException {
        String safeTag = sanitize(tag);
        Path location = snapshotsDirectory.resolve(stem + "." + safeTag + suffix);

        fileSystem.writeNewFile(location, content);

        Snapshot snapshot = new Snapshot(safeTag, Instant.now(clock), location);
        snapshots.add(snapshot);
        log.info("[Snapshots] Saved {} ({} chars)", location.getFileName(), content.length());
        return snapshot;
    }

    public String read(Snapshot snapshot) throws FileSystemException {
        return fileSystem.readFile(snapshot.getLocation());
    }

    /** Snapshots saved by this store, oldest first. */
    public List<Snapshot> list() {
        return Collections.unmodifiableList(snapshots);
    }

    public Path getRunDirectory() {
        return runDirectory;
    }

    public Path getSnapshotsDirectory() {
        return snapshotsDirectory;
    }

    static String sanitize(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Snapshot tag must not be blank");
        }
        return UNSAFE_TAG_CHARS.matcher(tag.strip()).replaceAll("_");
    }
}
