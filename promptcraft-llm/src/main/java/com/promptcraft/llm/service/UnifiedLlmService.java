package com.promptcraft.llm.service;

import com.promptcraft.common.constants.AiOperation;
import com.promptcraft.llm.exception.LlmRoutingException;
import com.promptcraft.llm.manager.LlmProviderManager;
import com.promptcraft.llm.model.GenerationRequest;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ImproveMode;
import com.promptcraft.llm.model.ProviderStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class UnifiedLlmService {
    
    static final String IMPROVE_SYSTEM_PROMPT = """
        You are an expert at improving AI prompts. Your task is to enhance the given prompt by making it more clear, specific, and effective. Focus on:
        - Making instructions clearer and more actionable
        - Adding relevant context where needed
        - Improving structure and flow
        - Ensuring the prompt will generate better results from AI models
        
        %s
        
        Return only the improved prompt without any explanations.""";
    
    static final String GENERATE_SYSTEM_PROMPT =
        "You are an expert at creating effective AI prompts. Create a well-structured prompt based on the user's "
            + "description. The prompt should be clear, specific, and optimized for AI models. "
            + "Return only the generated prompt without any explanations.";
    
    private static final int IMPROVE_MAX_TOKENS = 1000;
    private static final int GENERATE_MAX_TOKENS = 500;
    private static final double DEFAULT_TEMPERATURE = 0.7;
    
    private final LlmProviderManager manager;
    
    /**
     * Rewrites a prompt in the given mode. Provider failures come back as a response with
     * {@code success=false}; routing and configuration problems are thrown.
     */
    public GenerationResponse improvePrompt(String prompt, ImproveMode mode, PromptOptions options) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }
        ImproveMode effectiveMode = mode != null ? mode : ImproveMode.EXPAND;
        PromptOptions opts = options != null ? options : PromptOptions.DEFAULTS;
        
        GenerationRequest request = GenerationRequest.builder()
            .systemPrompt(String.format(IMPROVE_SYSTEM_PROMPT, effectiveMode.getInstruction()))
            .userPrompt("Please improve this prompt:\n\n\"" + prompt + "\"")
            .maxTokens(opts.getMaxTokens() != null ? opts.getMaxTokens() : IMPROVE_MAX_TOKENS)
            .temperature(opts.getTemperature() != null ? opts.getTemperature() : DEFAULT_TEMPERATURE)
            .model(opts.getModel())
            .operation(AiOperation.PROMPT_IMPROVE)
            .build();
        
        try {
            return dispatch(request, opts.isUseFallback());
        } catch (LlmRoutingException e) {
            log.error("[SERVICE] Failed to improve prompt | mode={} | error={}", effectiveMode, e.getMessage(), e);
            throw e;
        }
    }
    
    public GenerationResponse generatePrompt(String description, PromptOptions options) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description is required");
        }
        PromptOptions opts = options != null ? options : PromptOptions.DEFAULTS;
        
        GenerationRequest request = GenerationRequest.builder()
            .systemPrompt(GENERATE_SYSTEM_PROMPT)
            .userPrompt("Create a prompt for: " + description)
            .maxTokens(opts.getMaxTokens() != null ? opts.getMaxTokens() : GENERATE_MAX_TOKENS)
            .temperature(opts.getTemperature() != null ? opts.getTemperature() : DEFAULT_TEMPERATURE)
            .model(opts.getModel())
            .operation(AiOperation.PROMPT_GENERATE)
            .build();
        
        try {
            return dispatch(request, opts.isUseFallback());
        } catch (LlmRoutingException e) {
            log.error("[SERVICE] Failed to generate prompt | error={}", e.getMessage(), e);
            throw e;
        }
    }
    
    /**
     * Runs a fresh health sweep and pairs it with the current statistics.
     */
    public ProviderHealthReport getProviderHealth() {
        List<HealthStatus> health = manager.checkAllProviders();
        List<ProviderStats> stats = manager.getProviderStats();
        return new ProviderHealthReport(health, stats, Instant.now().toString());
    }
    
    public List<HealthStatus> checkProviderHealth() {
        return manager.checkAllProviders();
    }
    
    public List<ProviderStats> getProviderStats() {
        return manager.getProviderStats();
    }
    
    private GenerationResponse dispatch(GenerationRequest request, boolean useFallback) {
        return useFallback ? manager.generateWithFallback(request) : manager.generate(request);
    }
}
