package com.promptcraft.llm.provider.support;

import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff between retried attempts: {@code min(baseDelay * 2^retry, maxDelay)}.
 */
@Value
public class RetrySettings {
    
    public static final RetrySettings DEFAULT = new RetrySettings(Duration.ofMillis(500), Duration.ofSeconds(10));
    
    Duration baseDelay;
    Duration maxDelay;
    
    public long backoffMillis(int retry) {
        long base = Math.max(0, baseDelay.toMillis());
        long cap = Math.max(base, maxDelay.toMillis());
        int shift = Math.min(retry, 30);
        return Math.min(base * (1L << shift), cap);
    }
}
