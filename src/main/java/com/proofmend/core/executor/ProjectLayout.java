package com.proofmend.core.executor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Location of the Lake project that owns a target file.
 *
 * The root is the nearest ancestor directory holding one of the project markers
 * (lakefile.lean by default). Without a marker the file's own directory is the root.
 */
public final class ProjectLayout {

    private final Path root;
    private final Path projectFile;

    private ProjectLayout(Path root, Path projectFile) {
        this.root = root;
        this.projectFile = projectFile;
    }

    public static ProjectLayout discover(Path targetFile, List<String> markers) {
        Path file = targetFile.toAbsolutePath().normalize();
        Path parent = file.getParent();

        for (Path dir = parent; dir != null; dir = dir.getParent()) {
            for (String marker : markers) {
                Path candidate = dir.resolve(marker);
                if (Files.isRegularFile(candidate)) {
                    return new ProjectLayout(dir, candidate);
                }
            }
        }
        return new ProjectLayout(parent, null);
    }

    public Path getRoot() {
        return root;
    }

    public Optional<Path> getProjectFile() {
        return Optional.ofNullable(projectFile);
    }

    @Override
    public String toString() {
        return "ProjectLayout{root=" + root + ", projectFile=" + projectFile + "}";
    }
}
