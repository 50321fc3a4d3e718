package com.promptcraft.llm.model;

import com.promptcraft.common.constants.AiOperation;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Normalized text-generation request. Optional fields left null fall back to
 * provider defaults.
 */
@Value
@Builder(toBuilder = true)
public class GenerationRequest {
    
    @Builder.Default
    String systemPrompt = "";
    
    @ToString.Exclude
    String userPrompt;
    
    Integer maxTokens;
    
    Double temperature;
    
    String model;
    
    AiOperation operation;
    
    public boolean hasUserPrompt() {
        return userPrompt != null && !userPrompt.isBlank();
    }
    
    public int maxTokensOr(int fallback) {
        return maxTokens != null && maxTokens > 0 ? maxTokens : fallback;
    }
    
    public double temperatureOr(double fallback) {
        return temperature != null ? temperature : fallback;
    }
}
