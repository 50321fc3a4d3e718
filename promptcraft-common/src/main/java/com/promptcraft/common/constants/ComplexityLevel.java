package com.promptcraft.common.constants;

/**
 * Request complexity buckets, derived from the estimated prompt size.
 */
public enum ComplexityLevel {
    LOW,
    MEDIUM,
    HIGH;
    
    private static final int LOW_LIMIT_TOKENS = 500;
    private static final int MEDIUM_LIMIT_TOKENS = 2000;
    
    public static ComplexityLevel fromEstimatedTokens(int tokens) {
        if (tokens < LOW_LIMIT_TOKENS) return LOW;
        if (tokens < MEDIUM_LIMIT_TOKENS) return MEDIUM;
        return HIGH;
    }
}
