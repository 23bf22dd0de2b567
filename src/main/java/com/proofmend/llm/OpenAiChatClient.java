package com.proofmend.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAiChatClient - LLMClient backed by the OpenAI chat completions endpoint.
 *
 * One request per call: no retry, no streaming. The whole response is the unit of trust.
 * System prompts live here, keyed by role; callers only supply the user prompt.
 */
public class OpenAiChatClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final String patchModel;
    private final Duration timeout;

    public OpenAiChatClient(WebClient.Builder builder, ObjectMapper objectMapper, String baseUrl,
                            String apiKey, String model, String patchModel, Duration timeout) {
        this.webClient = builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
        this.objectMapper = objectMapper;
        this.model = model;
        this.patchModel = patchModel;
        this.timeout = timeout;
    }

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public String generateWithRole(OracleRole role, String userPrompt) {

        String modelForRole = role == OracleRole.PATCH ? patchModel : model;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelForRole);
        body.put("messages", List.of(
                Map.of("role", "system", "content", getSystemPromptForRole(role)),
                Map.of("role", "user", "content", userPrompt)
        ));
        if (role == OracleRole.PATCH) {
            body.put("temperature", 0);
        }

        log.info("[OpenAI] role={} model={} promptLen={}", role, modelForRole, userPrompt.length());

        String raw;
        try {
            raw = webClient
                    .post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new OracleException("OpenAI returned HTTP " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new OracleException("OpenAI request failed: " + rootMessage(e), e);
        }

        String content = extractContent(raw);
        log.debug("[OpenAI] role={} responseLen={}", role, content.length());
        return content;
    }

    // =========================================================================
    // System prompts
    // =========================================================================

    private String getSystemPromptForRole(OracleRole role) {
        return switch (role) {
            case REPAIR   -> "You are a precise Lean 4 refactoring and repair agent.";
            case EXTEND   -> "You extend Lean 4 files with thematically consistent new results.";
            case DOCUMENT -> "You add documentation and comments to Lean 4 files without changing their semantics.";
            case PATCH    -> "You edit Lean 4 files by emitting minimal unified diffs.";
        };
    }

    // =========================================================================
    // Response parsing
    // =========================================================================

    private String extractContent(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(raw);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            return content.isMissingNode() || content.isNull() ? "" : content.asText();
        } catch (Exception e) {
            log.error("[OpenAI] Failed to parse response ({} chars)", raw.length(), e);
            throw new OracleException("Malformed OpenAI response", e);
        }
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
