package com.proofmend.llm;

/**
 * LLMClient - transport to a chat model.
 *
 * The role selects the system prompt and model in the implementation;
 * callers only build the user prompt.
 */
public interface LLMClient {

    /**
     * @return raw model output. Never null; empty string on empty model output.
     * @throws OracleException when the request fails or the response cannot be read
     */
    String generateWithRole(OracleRole role, String userPrompt);
}
