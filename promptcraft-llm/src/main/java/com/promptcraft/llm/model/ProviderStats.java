package com.promptcraft.llm.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of a provider's usage counters. Each completed invocation
 * produces the next snapshot through {@link #record}.
 */
@Value
@Builder(toBuilder = true)
public class ProviderStats {
    String provider;
    long totalRequests;
    long successfulRequests;
    long failedRequests;
    double averageResponseTime;
    double totalCostCents;
    Instant lastUsed;
    
    public static ProviderStats initial(String provider) {
        return ProviderStats.builder().provider(provider).build();
    }
    
    public ProviderStats record(boolean success, long responseTimeMs, double costCents, Instant now) {
        long total = totalRequests + 1;
        return toBuilder()
            .totalRequests(total)
            .successfulRequests(success ? successfulRequests + 1 : successfulRequests)
            .failedRequests(success ? failedRequests : failedRequests + 1)
            .averageResponseTime(averageResponseTime + (responseTimeMs - averageResponseTime) / total)
            .totalCostCents(totalCostCents + Math.max(0.0, costCents))
            .lastUsed(now)
            .build();
    }
    
    public double successRate() {
        return totalRequests == 0 ? 1.0 : (double) successfulRequests / totalRequests;
    }
}
