package com.promptcraft.llm.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Token counts and cost of one generation. The total is always derived from the
 * input and output counts.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TokenUsage {
    
    private static final TokenUsage EMPTY = new TokenUsage(0, 0, 0.0);
    
    private final int inputTokens;
    private final int outputTokens;
    private final int totalTokens;
    private final double costCents;
    
    private TokenUsage(int inputTokens, int outputTokens, double costCents) {
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
        this.totalTokens = inputTokens + outputTokens;
        this.costCents = costCents;
    }
    
    public static TokenUsage of(int inputTokens, int outputTokens, double costCents) {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException(
                "Token counts must be non-negative: input=" + inputTokens + ", output=" + outputTokens);
        }
        if (costCents < 0 || Double.isNaN(costCents) || Double.isInfinite(costCents)) {
            throw new IllegalArgumentException("Cost must be a non-negative finite amount: " + costCents);
        }
        return new TokenUsage(inputTokens, outputTokens, costCents);
    }
    
    public static TokenUsage empty() {
        return EMPTY;
    }
}
