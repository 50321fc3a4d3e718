package com.promptcraft.llm.exception;

import com.promptcraft.common.constants.AiOperation;
import lombok.Getter;

/**
 * No enabled provider configures a model recommended for the requested operation.
 */
@Getter
public class NoSuitableModelException extends LlmRoutingException {
    
    private final AiOperation operation;
    
    public NoSuitableModelException(AiOperation operation) {
        super("No enabled provider has a model recommended for operation '" + operation + "'");
        this.operation = operation;
    }
}
