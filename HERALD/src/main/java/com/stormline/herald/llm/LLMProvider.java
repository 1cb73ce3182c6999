package com.stormline.herald.llm;

import reactor.core.publisher.Mono;

/**
 * Interface for LLM provider implementations.
 */
public interface LLMProvider {

    /**
     * Complete a prompt with the LLM (non-streaming).
     *
     * @param request the completion request
     * @return the completion response
     */
    Mono<LLMResponse> complete(LLMRequest request);

    /**
     * Get the provider ID.
     *
     * @return provider ID (e.g., "azure-openai")
     */
    String getProviderId();

    /**
     * Check if this provider supports tool/function calling.
     *
     * @return true if tools are supported
     */
    boolean supportsTools();

    /**
     * Get the default model (or deployment) for this provider.
     *
     * @return default model ID
     */
    String getDefaultModel();
}
