package com.promptcraft.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Normalized failure categories for vendor calls.
 */
@Getter
@RequiredArgsConstructor
public enum ProviderErrorType {
    
    PROVIDER_UNAVAILABLE(true, "Provider unavailable"),
    AUTHENTICATION(false, "Invalid API key"),
    RATE_LIMITED(true, "Rate limit exceeded"),
    INVALID_REQUEST(false, "Invalid request"),
    TIMEOUT(true, "Request timeout");
    
    private final boolean retryable;
    private final String description;
    
    public static ProviderErrorType fromStatus(int status) {
        if (status == 401 || status == 403) return AUTHENTICATION;
        if (status == 429) return RATE_LIMITED;
        if (status == 408) return TIMEOUT;
        if (status >= 500) return PROVIDER_UNAVAILABLE;
        return INVALID_REQUEST;
    }
}
