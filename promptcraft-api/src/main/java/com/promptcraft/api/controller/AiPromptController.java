package com.promptcraft.api.controller;

import com.promptcraft.api.dto.request.GeneratePromptRequest;
import com.promptcraft.api.dto.request.ImprovePromptRequest;
import com.promptcraft.api.dto.response.GenerationResult;
import com.promptcraft.api.exception.ProviderFailureException;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.service.PromptOptions;
import com.promptcraft.llm.service.UnifiedLlmService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/ai")
@RequiredArgsConstructor
@Slf4j
public class AiPromptController {
    
    private final UnifiedLlmService llmService;
    
    @PostMapping("/improve")
    public ResponseEntity<GenerationResult> improvePrompt(@Valid @RequestBody ImprovePromptRequest request) {
        PromptOptions options = PromptOptions.builder()
            .maxTokens(request.getMaxTokens())
            .temperature(request.getTemperature())
            .model(request.getModel())
            .useFallback(request.isUseFallback())
            .build();
        
        GenerationResponse response = llmService.improvePrompt(request.getPrompt(), request.getMode(), options);
        return toResult(response);
    }
    
    @PostMapping("/generate")
    public ResponseEntity<GenerationResult> generatePrompt(@Valid @RequestBody GeneratePromptRequest request) {
        PromptOptions options = PromptOptions.builder()
            .maxTokens(request.getMaxTokens())
            .temperature(request.getTemperature())
            .model(request.getModel())
            .useFallback(request.isUseFallback())
            .build();
        
        GenerationResponse response = llmService.generatePrompt(request.getDescription(), options);
        return toResult(response);
    }
    
    private ResponseEntity<GenerationResult> toResult(GenerationResponse response) {
        if (!response.isSuccess()) {
            throw new ProviderFailureException(response);
        }
        log.info("[API] Prompt request completed | provider={} | model={} | tokens={} | durationMs={}",
            response.getProvider(), response.getModel(), response.getUsage().getTotalTokens(),
            response.getResponseTimeMs());
        return ResponseEntity.ok(GenerationResult.from(response));
    }
}
