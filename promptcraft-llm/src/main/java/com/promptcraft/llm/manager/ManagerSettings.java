package com.promptcraft.llm.manager;

import lombok.Builder;
import lombok.Value;

/**
 * Routing settings of a {@link LlmProviderManager}.
 */
@Value
@Builder
public class ManagerSettings {
    
    String defaultProvider;
    
    String fallbackProvider;
    
    @Builder.Default
    LoadBalancingStrategy strategy = LoadBalancingStrategy.CHEAPEST;
    
    boolean costOptimization;
    
    /** Per-request budget applied when cost optimization is on. */
    @Builder.Default
    double maxCostPerRequestCents = 50.0;
    
    /** Output-token estimate for requests that do not set a limit. */
    @Builder.Default
    int defaultMaxTokens = 1000;
}
