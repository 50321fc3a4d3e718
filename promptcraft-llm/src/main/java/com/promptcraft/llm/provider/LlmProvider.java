package com.promptcraft.llm.provider;

import com.promptcraft.llm.model.GenerationRequest;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ProviderConfig;

/**
 * One external generation backend.
 *
 * <p>Implementations turn vendor failures into a {@link GenerationResponse} with
 * {@code success=false}; they do not throw for vendor-side problems.
 */
public interface LlmProvider {
    
    GenerationResponse generate(GenerationRequest request);
    
    /**
     * Sends a minimal probe request. Completes within the configured timeout;
     * a probe that runs out of time reports unhealthy.
     */
    HealthStatus checkHealth();
    
    /** Copy of the provider's configuration; changing it does not affect the provider. */
    ProviderConfig getConfig();
    
    default String getName() {
        return getConfig().getName();
    }
}
