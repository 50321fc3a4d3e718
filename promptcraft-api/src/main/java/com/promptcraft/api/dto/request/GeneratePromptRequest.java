package com.promptcraft.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class GeneratePromptRequest {
    
    @NotBlank(message = "Description is required")
    private String description;
    
    private boolean useFallback = false;
    
    @Positive
    private Integer maxTokens;
    
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private Double temperature;
    
    private String model;
}
