package com.promptcraft.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthStatus {
    String provider;
    boolean healthy;
    long responseTimeMs;
    Instant lastChecked;
    String error;
    
    public static HealthStatus healthy(String provider, long responseTimeMs) {
        return new HealthStatus(provider, true, responseTimeMs, Instant.now(), null);
    }
    
    public static HealthStatus unhealthy(String provider, long responseTimeMs, String error) {
        return new HealthStatus(provider, false, responseTimeMs, Instant.now(), error);
    }
}
