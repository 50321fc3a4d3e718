package com.promptcraft.common.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of generation task. Models declare which of these they are recommended for,
 * and the router uses the tag to match a request to capable models.
 */
public enum AiOperation {
    PROMPT_IMPROVE("prompt-improve"),
    PROMPT_GENERATE("prompt-generate"),
    CONTENT_SUMMARIZE("content-summarize"),
    CONTENT_EXPAND("content-expand"),
    CODE_REVIEW("code-review"),
    TRANSLATION("translation"),
    ANALYSIS("analysis");
    
    private final String tag;
    
    AiOperation(String tag) {
        this.tag = tag;
    }
    
    @JsonValue
    public String getTag() {
        return tag;
    }
    
    @JsonCreator
    public static AiOperation fromTag(String value) {
        for (AiOperation operation : values()) {
            if (operation.tag.equalsIgnoreCase(value) || operation.name().equalsIgnoreCase(value)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + value);
    }
    
    @Override
    public String toString() {
        return tag;
    }
}
