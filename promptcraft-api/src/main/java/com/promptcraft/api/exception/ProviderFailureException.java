package com.promptcraft.api.exception;

import com.promptcraft.llm.model.GenerationResponse;
import lombok.Getter;

/**
 * Raised at the HTTP boundary when every attempted provider returned a failed response.
 */
@Getter
public class ProviderFailureException extends RuntimeException {
    
    private final GenerationResponse response;
    
    public ProviderFailureException(GenerationResponse response) {
        super("Provider " + response.getProvider() + " failed: " + response.getErrorType());
        this.response = response;
    }
}
