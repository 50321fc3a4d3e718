package com.promptcraft.api.dto.request;

import com.promptcraft.llm.model.ImproveMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class ImprovePromptRequest {
    
    @NotBlank(message = "Prompt is required")
    private String prompt;
    
    @NotNull(message = "Mode is required")
    private ImproveMode mode;
    
    private boolean useFallback = false;
    
    @Positive
    private Integer maxTokens;
    
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private Double temperature;
    
    private String model;
}
