package com.proofmend.core.executor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LakeToolchainTest {

    @TempDir
    Path tempDir;

    private final CommandExecutor executor = mock(CommandExecutor.class);

    private LakeToolchain toolchain(Path root) {
        ProjectLayout layout = ProjectLayout.discover(root.resolve("Play.lean"), List.of("lakefile.lean"));
        return new LakeToolchain(executor, layout, List.of("lake", "build"),
                List.of(CheckTier.parse("lake env lean --make"), CheckTier.parse("lean --make")),
                Duration.ofMinutes(20), Duration.ofSeconds(60));
    }

    @Test
    void testBuildRunsInProjectRoot() {
        when(executor.execute(any(), any(), any())).thenReturn(CommandResult.completed(0, "", "", 5));

        CommandResult result = toolchain(tempDir).build();

        assertTrue(result.isSuccess());
        verify(executor).execute(eq(List.of("lake", "build")), eq(tempDir.toAbsolutePath().normalize()),
                eq(Duration.ofMinutes(20)));
    }

    @Test
    void testFirstTierIsUsedWhenAvailable() {
        Path file = tempDir.resolve("Play.lean");
        when(executor.execute(any(), any(), any())).thenReturn(CommandResult.completed(1, "boom", "", 5));

        CommandResult result = toolchain(tempDir).checkFile(file);

        assertEquals(1, result.getExitCode());
        verify(executor, times(1)).execute(any(), any(), any());
        verify(executor).execute(eq(List.of("lake", "env", "lean", "--make", file.toString())), any(), any());
    }

    @Test
    void testFallsBackWhenFirstTierIsMissing() {
        Path file = tempDir.resolve("Play.lean");
        when(executor.execute(eq(List.of("lake", "env", "lean", "--make", file.toString())), any(), any()))
                .thenReturn(CommandResult.toolUnavailable("Command not available: lake"));
        when(executor.execute(eq(List.of("lean", "--make", file.toString())), any(), any()))
                .thenReturn(CommandResult.completed(0, "", "", 5));

        CommandResult result = toolchain(tempDir).checkFile(file);

        assertTrue(result.isSuccess());
    }

    @Test
    void testAllTiersMissingIsToolUnavailable() {
        when(executor.execute(any(), any(), any())).thenReturn(CommandResult.toolUnavailable("missing"));

        CommandResult result = toolchain(tempDir).checkFile(tempDir.resolve("Play.lean"));

        assertTrue(result.isToolUnavailable());
        assertTrue(result.getStderr().startsWith("No check tool available"));
        verify(executor, times(2)).execute(any(), any(), any());
    }

    @Test
    void testLayoutFindsNearestMarkerAbove() throws Exception {
        Path project = tempDir.resolve("proj");
        Path nested = Files.createDirectories(project.resolve("Proj/Sub"));
        Files.writeString(project.resolve("lakefile.lean"), "import Lake\n");

        ProjectLayout layout = ProjectLayout.discover(nested.resolve("Play.lean"), List.of("lakefile.lean"));

        assertEquals(project.toAbsolutePath().normalize(), layout.getRoot());
        assertTrue(layout.getProjectFile().isPresent());
    }

    @Test
    void testLayoutWithoutMarkerUsesFileDirectory() {
        Path dir = tempDir.resolve("loose");

        ProjectLayout layout = ProjectLayout.discover(dir.resolve("Play.lean"), List.of("no-such-marker.xyz"));

        assertEquals(dir.toAbsolutePath().normalize(), layout.getRoot());
        assertTrue(layout.getProjectFile().isEmpty());
    }

    @Test
    void testCheckTierParsing() {
        CheckTier tier = CheckTier.parse("  lake env   lean --make ");

        assertEquals("lake env   lean --make", tier.getName());
        assertEquals(List.of("lake", "env", "lean", "--make", "X.lean"), tier.commandFor(Path.of("X.lean")));
        assertThrows(IllegalArgumentException.class, () -> CheckTier.parse("   "));
    }
}
