package com.promptcraft.llm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a prompt should be improved.
 */
@Getter
@RequiredArgsConstructor
public enum ImproveMode {
    
    TIGHTEN(
        "tighten",
        "Tighten the prompt: make it concise, remove filler and redundancy, keep every requirement."
    ),
    
    EXPAND(
        "expand",
        "Expand the prompt: add relevant context, concrete constraints and the expected output format."
    );
    
    private final String value;
    private final String instruction;
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static ImproveMode fromString(String name) {
        for (ImproveMode mode : values()) {
            if (mode.value.equalsIgnoreCase(name) || mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown improve mode: " + name);
    }
}
