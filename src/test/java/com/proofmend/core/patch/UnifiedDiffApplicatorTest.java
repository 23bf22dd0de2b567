package com.proofmend.core.patch;

import com.proofmend.core.executor.CommandExecutor;
import com.proofmend.core.executor.CommandResult;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class UnifiedDiffApplicatorTest {

    @TempDir
    Path tempDir;

    private static final String DIFF = """
            --- Play.lean
            +++ Play.lean
            @@ -1 +1,2 @@
            +open Classical
             theorem t : True := trivial
            """;

    private final CommandExecutor executor = mock(CommandExecutor.class);
    private final UnifiedDiffApplicator applicator =
            new UnifiedDiffApplicator(executor, "patch -p0 -i", Duration.ofSeconds(60));

    @Test
    @SuppressWarnings("unchecked")
    void testRunsPatchInTargetDirectoryAndDeletesTempFile() {
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        when(executor.execute(command.capture(), eq(tempDir), any()))
                .thenAnswer(invocation -> {
                    List<String> args = invocation.getArgument(0);
                    Path patchFile = Path.of(args.get(args.size() - 1));
                    assertEquals(DIFF, Files.readString(patchFile));
                    return CommandResult.completed(0, "patching file Play.lean\n", "", 5);
                });

        assertTrue(applicator.apply(DIFF, tempDir));

        List<String> args = command.getValue();
        assertEquals(List.of("patch", "-p0", "-i"), args.subList(0, 3));
        assertFalse(Files.exists(Path.of(args.get(3))), "Temp patch file must be removed");
    }

    @Test
    void testNonZeroExitIsFailure() {
        when(executor.execute(any(), any(), any()))
                .thenReturn(CommandResult.completed(1, "Hunk #1 FAILED", "", 5));

        assertFalse(applicator.apply(DIFF, tempDir));
    }

    @Test
    void testMissingPatchBinaryIsFailure() {
        when(executor.execute(any(), any(), any()))
                .thenReturn(CommandResult.toolUnavailable("Command not available: patch"));

        assertFalse(applicator.apply(DIFF, tempDir));
    }

    @Test
    void testUnwritableDiffLeavesNoTempFileBehind() throws Exception {
        long before = leftoverPatchFiles();

        // A lone surrogate cannot be encoded as UTF-8, so writing the temp file fails.
        assertFalse(applicator.apply(DIFF + "\uD800\n", tempDir));

        assertEquals(before, leftoverPatchFiles());
        verifyNoInteractions(executor);
    }

    private static long leftoverPatchFiles() throws IOException {
        try (Stream<Path> files = Files.list(Path.of(System.getProperty("java.io.tmpdir")))) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.startsWith("proofmend_") && name.endsWith(".patch"))
                    .count();
        }
    }

    @Test
    void testBlankDiffIsNotApplied() {
        assertFalse(applicator.apply("   \n", tempDir));
        assertFalse(applicator.apply(null, tempDir));
        verifyNoInteractions(executor);
    }
}
