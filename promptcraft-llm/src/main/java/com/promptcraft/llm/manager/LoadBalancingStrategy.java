package com.promptcraft.llm.manager;

import com.promptcraft.llm.exception.LlmConfigurationException;

/**
 * How the manager ranks eligible providers for a request.
 */
public enum LoadBalancingStrategy {
    /** Lowest estimated cost for the request. */
    CHEAPEST,
    /** Lowest observed average response time. */
    FASTEST,
    /** Configured default provider first, then ascending priority. */
    PRIORITY,
    ROUND_ROBIN,
    LEAST_USED;
    
    public static LoadBalancingStrategy fromString(String name) {
        if (name == null || name.isBlank()) {
            return CHEAPEST;
        }
        String normalized = name.trim().replace('-', '_');
        for (LoadBalancingStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(normalized)) {
                return strategy;
            }
        }
        throw new LlmConfigurationException("Unknown load-balancing strategy: " + name);
    }
}
