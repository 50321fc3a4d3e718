package com.promptcraft.llm.model;

import com.promptcraft.common.constants.AiOperation;
import com.promptcraft.common.constants.ComplexityLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pricing and capability description of one model. Costs are in cents per 1,000 tokens.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelConfig {
    
    private String name;
    
    private String provider;
    
    @Builder.Default
    private int maxTokens = 4096;
    
    private double inputCostPer1K;
    
    private double outputCostPer1K;
    
    @Builder.Default
    private int contextWindow = 128000;
    
    @Builder.Default
    private Set<ComplexityLevel> capabilities = new LinkedHashSet<>();
    
    @Builder.Default
    private List<AiOperation> recommendedFor = new ArrayList<>();
    
    public boolean isRecommendedFor(AiOperation operation) {
        return recommendedFor != null && recommendedFor.contains(operation);
    }
    
    public boolean supportsComplexity(ComplexityLevel level) {
        return capabilities != null && capabilities.contains(level);
    }
    
    /** Detached copy; collections are copied too. */
    public ModelConfig copy() {
        return toBuilder()
            .capabilities(capabilities != null ? new LinkedHashSet<>(capabilities) : new LinkedHashSet<>())
            .recommendedFor(recommendedFor != null ? new ArrayList<>(recommendedFor) : new ArrayList<>())
            .build();
    }
    
    /** Combined per-1K rate, used to rank models by price. */
    public double combinedCostPer1K() {
        return inputCostPer1K + outputCostPer1K;
    }
}
