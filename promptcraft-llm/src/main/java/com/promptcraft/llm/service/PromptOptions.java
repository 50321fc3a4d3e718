package com.promptcraft.llm.service;

import lombok.Builder;
import lombok.Value;

/**
 * Optional knobs of the prompt convenience operations. Unset values use the operation's defaults.
 */
@Value
@Builder
public class PromptOptions {
    
    public static final PromptOptions DEFAULTS = PromptOptions.builder().build();
    
    Integer maxTokens;
    Double temperature;
    String model;
    boolean useFallback;
}
