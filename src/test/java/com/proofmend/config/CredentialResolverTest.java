package com.proofmend.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CredentialResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void testConfiguredKeyWins() throws Exception {
        Files.writeString(tempDir.resolve("openai_key.txt"), "from-file");
        CredentialResolver resolver = new CredentialResolver(tempDir);

        assertEquals(Optional.of("from-env"), resolver.resolve("  from-env \n", "openai_key.txt"));
    }

    @Test
    void testFallsBackToTrimmedKeyFile() throws Exception {
        Files.writeString(tempDir.resolve("openai_key.txt"), "\n  sk-file-key  \n");
        CredentialResolver resolver = new CredentialResolver(tempDir);

        assertEquals(Optional.of("sk-file-key"), resolver.resolve("", "openai_key.txt"));
    }

    @Test
    void testBlankKeyFileCountsAsAbsent() throws Exception {
        Files.writeString(tempDir.resolve("openai_key.txt"), "   \n");
        CredentialResolver resolver = new CredentialResolver(tempDir);

        assertTrue(resolver.resolve(null, "openai_key.txt").isEmpty());
    }

    @Test
    void testNothingConfigured() {
        CredentialResolver resolver = new CredentialResolver(tempDir);

        assertTrue(resolver.resolve(" ", "openai_key.txt").isEmpty());
        assertTrue(resolver.resolve(null, null).isEmpty());
    }
}
