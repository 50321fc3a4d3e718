package com.promptcraft.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptcraft.llm.provider.ProviderErrorType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

/**
 * Normalized provider response. Instances come from {@link #success} or
 * {@link #failure}, so a successful response never carries an error message and a
 * failed one always does.
 */
@Getter
@ToString(exclude = "content")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationResponse {
    
    private final String content;
    private final TokenUsage usage;
    private final String provider;
    private final String model;
    @With
    private final long responseTimeMs;
    private final boolean success;
    private final String error;
    private final ProviderErrorType errorType;
    @With
    private final String warning;
    
    public static GenerationResponse success(String content, TokenUsage usage, String provider,
                                             String model, long responseTimeMs) {
        return new GenerationResponse(
            content != null ? content : "",
            usage != null ? usage : TokenUsage.empty(),
            provider, model, Math.max(0, responseTimeMs), true, null, null, null
        );
    }
    
    public static GenerationResponse failure(String provider, String model, ProviderErrorType errorType,
                                             String error, TokenUsage usage, long responseTimeMs) {
        String message = error != null && !error.isBlank() ? error : errorType.getDescription();
        return new GenerationResponse(
            "",
            usage != null ? usage : TokenUsage.empty(),
            provider, model, Math.max(0, responseTimeMs), false, message, errorType, null
        );
    }
}
