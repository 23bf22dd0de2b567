package com.proofmend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves the oracle API key: the configured value (usually from OPENAI_API_KEY)
 * first, then the contents of a key file. Blank values count as absent.
 */
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final Path baseDirectory;

    public CredentialResolver(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    public Optional<String> resolve(String configuredKey, String keyFile) {

        if (configuredKey != null && !configuredKey.isBlank()) {
            log.info("[Credentials] Using API key from configuration");
            return Optional.of(configuredKey.strip());
        }

        if (keyFile == null || keyFile.isBlank()) {
            return Optional.empty();
        }

        Path path = baseDirectory.resolve(keyFile.strip());
        if (!Files.isRegularFile(path)) {
            log.info("[Credentials] No API key configured and no key file at {}", path);
            return Optional.empty();
        }

        try {
            String key = Files.readString(path, StandardCharsets.UTF_8).strip();
            if (key.isEmpty()) {
                log.warn("[Credentials] Key file {} is empty", path);
                return Optional.empty();
            }
            log.info("[Credentials] Using API key from {}", path);
            return Optional.of(key);
        } catch (IOException e) {
            log.warn("[Credentials] Could not read key file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
