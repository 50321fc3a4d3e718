package com.promptcraft.api.controller;

import com.promptcraft.api.exception.GlobalExceptionHandler;
import com.promptcraft.common.constants.AiOperation;
import com.promptcraft.llm.exception.LlmConfigurationException;
import com.promptcraft.llm.exception.NoSuitableModelException;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.ImproveMode;
import com.promptcraft.llm.model.TokenUsage;
import com.promptcraft.llm.provider.ProviderErrorType;
import com.promptcraft.llm.service.PromptOptions;
import com.promptcraft.llm.service.UnifiedLlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AiPromptControllerTest {
    
    private UnifiedLlmService llmService;
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        llmService = mock(UnifiedLlmService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new AiPromptController(llmService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }
    
    @Test
    void improveReturnsGeneratedContent() throws Exception {
        when(llmService.improvePrompt(eq("Write a poem"), eq(ImproveMode.TIGHTEN), any(PromptOptions.class)))
            .thenReturn(GenerationResponse.success("Poem, short.", TokenUsage.of(40, 5, 0.0093), "openai", "gpt-4o-mini", 812));
        
        mockMvc.perform(post("/api/v1/ai/improve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\":\"Write a poem\",\"mode\":\"tighten\",\"useFallback\":true,\"maxTokens\":200}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content").value("Poem, short."))
            .andExpect(jsonPath("$.provider").value("openai"))
            .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
            .andExpect(jsonPath("$.usage.totalTokens").value(45))
            .andExpect(jsonPath("$.responseTimeMs").value(812));
        
        ArgumentCaptor<PromptOptions> options = ArgumentCaptor.forClass(PromptOptions.class);
        verify(llmService).improvePrompt(eq("Write a poem"), eq(ImproveMode.TIGHTEN), options.capture());
        assertTrue(options.getValue().isUseFallback());
        assertEquals(200, options.getValue().getMaxTokens());
    }
    
    @Test
    void blankPromptIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/ai/improve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\":\"  \",\"mode\":\"expand\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation failed"));
        
        verifyNoInteractions(llmService);
    }
    
    @Test
    void unknownModeIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/ai/improve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\":\"Write\",\"mode\":\"shout\"}"))
            .andExpect(status().isBadRequest());
        
        verifyNoInteractions(llmService);
    }
    
    @Test
    void providerFailureIsBadGatewayWithoutVendorDetail() throws Exception {
        when(llmService.generatePrompt(anyString(), any(PromptOptions.class)))
            .thenReturn(GenerationResponse.failure("openai", "gpt-4o-mini", ProviderErrorType.RATE_LIMITED,
                "Rate limit reached for org-secret123", TokenUsage.empty(), 30000));
        
        mockMvc.perform(post("/api/v1/ai/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"a haiku\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("AI provider request failed"))
            .andExpect(jsonPath("$.message").value("Rate limit exceeded"))
            .andExpect(jsonPath("$.message").value(not(containsString("org-secret123"))));
    }
    
    @Test
    void noSuitableModelIsServiceUnavailable() throws Exception {
        when(llmService.generatePrompt(anyString(), any(PromptOptions.class)))
            .thenThrow(new NoSuitableModelException(AiOperation.PROMPT_GENERATE));
        
        mockMvc.perform(post("/api/v1/ai/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"a haiku\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("No AI provider available"));
    }
    
    @Test
    void configurationErrorIsInternalError() throws Exception {
        when(llmService.generatePrompt(anyString(), any(PromptOptions.class)))
            .thenThrow(new LlmConfigurationException("Unknown load-balancing strategy: random"));
        
        mockMvc.perform(post("/api/v1/ai/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"a haiku\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("AI service misconfigured"));
    }
}
