package com.promptcraft.llm.exception;

public class NoProviderAvailableException extends LlmRoutingException {
    
    public NoProviderAvailableException(String message) {
        super(message);
    }
}
