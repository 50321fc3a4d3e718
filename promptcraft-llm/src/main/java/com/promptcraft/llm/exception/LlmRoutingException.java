package com.promptcraft.llm.exception;

/**
 * Base of the failures the manager surfaces to callers instead of a response:
 * routing is impossible or the deployment is misconfigured.
 */
public abstract class LlmRoutingException extends RuntimeException {
    
    protected LlmRoutingException(String message) {
        super(message);
    }
    
    protected LlmRoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
