package com.z254.butterfly.concierge.llm;

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
     * @return provider ID (e.g., "openai")
     */
    String getProviderId();

    /**
     * Get the default model for this provider.
     *
     * @return default model ID
     */
    String getDefaultModel();
}
