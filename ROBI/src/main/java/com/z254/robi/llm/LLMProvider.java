package com.z254.robi.llm;

import reactor.core.publisher.Flux;
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
     * Stream a completion from the LLM.
     *
     * @param request the completion request
     * @return flux of completion chunks
     */
    Flux<LLMChunk> stream(LLMRequest request);

    /**
     * Get the provider ID.
     *
     * @return provider ID (e.g., "gemini")
     */
    String getProviderId();

    /**
     * Check if this provider is currently available.
     *
     * @return true if the provider is available
     */
    Mono<Boolean> isAvailable();

    String getDefaultModel();
}
