package com.purchasingpower.recall.client;

/**
 * Unified interface for chat-completion LLM providers.
 *
 * Implementations handle provider-specific API details and return the raw
 * response text; parsing and validation belong to the caller.
 *
 * @since 1.0.0
 */
public interface LLMProvider {

    /**
     * Execute chat completion with the LLM.
     *
     * @param prompt         The prompt to send
     * @param purpose        Name of the calling component (for logging)
     * @param conversationId Session the call belongs to
     * @return The LLM's response text
     */
    String chat(String prompt, String purpose, String conversationId);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
