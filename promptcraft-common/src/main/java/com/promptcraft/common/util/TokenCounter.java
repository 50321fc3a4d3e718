package com.promptcraft.common.util;

/**
 * Rough token estimator used when a provider does not report usage.
 * Approximation: 1 token ≈ 4 characters for English text
 */
public final class TokenCounter {
    private static final double CHARS_PER_TOKEN = 4.0;
    
    private TokenCounter() {}
    
    public static int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
    }
    
    public static int countTokens(String... parts) {
        int total = 0;
        for (String part : parts) {
            total += countTokens(part);
        }
        return total;
    }
}
