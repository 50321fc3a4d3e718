package com.promptcraft.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.TokenUsage;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationResult {
    private String content;
    private String provider;
    private String model;
    private TokenUsage usage;
    private long responseTimeMs;
    private String warning;
    
    public static GenerationResult from(GenerationResponse response) {
        return GenerationResult.builder()
            .content(response.getContent())
            .provider(response.getProvider())
            .model(response.getModel())
            .usage(response.getUsage())
            .responseTimeMs(response.getResponseTimeMs())
            .warning(response.getWarning())
            .build();
    }
}
