package com.proofmend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofmend.llm.DecliningPatchOracle;
import com.proofmend.llm.LlmPatchOracle;
import com.proofmend.llm.OpenAiChatClient;
import com.proofmend.llm.PatchOracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Wires the patch oracle from an explicit credential.
 * Without one the oracle is a {@link DecliningPatchOracle}, never null.
 */
@Configuration
public class OracleConfig {

    private static final Logger log = LoggerFactory.getLogger(OracleConfig.class);

    @Bean
    public PatchOracle patchOracle(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            @Value("${proofmend.oracle.api-key:}") String apiKey,
            @Value("${proofmend.oracle.api-key-file:openai_key.txt}") String apiKeyFile,
            @Value("${proofmend.oracle.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${proofmend.oracle.model:gpt-5}") String model,
            @Value("${proofmend.oracle.patch-model:gpt-4o-mini}") String patchModel,
            @Value("${proofmend.oracle.timeout:PT5M}") Duration timeout,
            @Value("${proofmend.oracle.max-error-lines:20}") int maxErrorLines
    ) {
        CredentialResolver resolver = new CredentialResolver(Path.of("").toAbsolutePath());
        Optional<String> credential = resolver.resolve(apiKey, apiKeyFile);

        if (credential.isEmpty()) {
            log.warn("[Oracle] No API key found; oracle steps will be skipped");
            return new DecliningPatchOracle();
        }

        log.info("[Oracle] Using OpenAI at {} (model={}, patch model={})", baseUrl, model, patchModel);
        OpenAiChatClient client = new OpenAiChatClient(
                webClientBuilder, objectMapper, baseUrl, credential.get(), model, patchModel, timeout);
        return new LlmPatchOracle(client, maxErrorLines);
    }
}
