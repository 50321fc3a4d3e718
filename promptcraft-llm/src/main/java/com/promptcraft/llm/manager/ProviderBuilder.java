package com.promptcraft.llm.manager;

import com.promptcraft.llm.model.ProviderConfig;
import com.promptcraft.llm.provider.LlmProvider;

/**
 * Turns a provider configuration into a live provider.
 */
@FunctionalInterface
public interface ProviderBuilder {
    
    LlmProvider build(ProviderConfig config);
}
