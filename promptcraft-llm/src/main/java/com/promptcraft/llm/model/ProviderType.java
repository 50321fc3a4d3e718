package com.promptcraft.llm.model;

/**
 * Provider implementations the factory knows how to build.
 */
public enum ProviderType {
    OPENAI,
    ANTHROPIC,
    MOCK
}
