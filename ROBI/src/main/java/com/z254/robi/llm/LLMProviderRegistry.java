package com.z254.robi.llm;

import com.z254.robi.config.RobiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry for LLM providers.
 */
@Component
@Slf4j
public class LLMProviderRegistry {

    private final Map<String, LLMProvider> providers = new HashMap<>();
    private final String defaultProviderId;

    public LLMProviderRegistry(List<LLMProvider> providerList, RobiProperties robiProperties) {
        this.defaultProviderId = robiProperties.getLlm().getDefaultProvider();

        for (LLMProvider provider : providerList) {
            providers.put(provider.getProviderId(), provider);
            log.info("Registered LLM provider: {}", provider.getProviderId());
        }

        log.info("Default LLM provider: {}", defaultProviderId);
    }

    /**
     * Get a provider by ID.
     *
     * @param providerId the provider ID
     * @return the provider
     * @throws IllegalArgumentException if provider not found
     */
    public LLMProvider getProvider(String providerId) {
        LLMProvider provider = providers.get(providerId);
        if (provider == null) {
            throw new IllegalArgumentException("No LLM provider found: " + providerId);
        }
        return provider;
    }

    public LLMProvider getDefaultProvider() {
        return getProvider(defaultProviderId);
    }

    public String getDefaultProviderId() {
        return defaultProviderId;
    }

    public Set<String> getProviderIds() {
        return providers.keySet();
    }
}
