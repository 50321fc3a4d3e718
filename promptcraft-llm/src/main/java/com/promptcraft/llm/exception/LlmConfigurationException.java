package com.promptcraft.llm.exception;

/**
 * Deployment mistake: unknown strategy, missing default or fallback provider, and the like.
 */
public class LlmConfigurationException extends LlmRoutingException {
    
    public LlmConfigurationException(String message) {
        super(message);
    }
    
    public LlmConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
