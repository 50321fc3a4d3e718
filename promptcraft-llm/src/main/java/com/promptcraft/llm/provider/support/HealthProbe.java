package com.promptcraft.llm.provider.support;

import com.promptcraft.llm.model.GenerationRequest;

/**
 * The minimal request every provider uses to check reachability.
 */
public final class HealthProbe {
    
    public static final GenerationRequest REQUEST = GenerationRequest.builder()
        .systemPrompt("You are a helpful assistant.")
        .userPrompt("Say \"Hello\"")
        .maxTokens(10)
        .temperature(0.0)
        .build();
    
    private HealthProbe() {}
}
