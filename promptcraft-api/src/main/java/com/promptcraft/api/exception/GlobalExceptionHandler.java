package com.promptcraft.api.exception;

import com.promptcraft.api.dto.response.ErrorResponse;
import com.promptcraft.llm.exception.LlmConfigurationException;
import com.promptcraft.llm.exception.NoProviderAvailableException;
import com.promptcraft.llm.exception.NoSuitableModelException;
import com.promptcraft.llm.model.GenerationResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            errors.append(fieldName).append(": ").append(error.getDefaultMessage()).append("; ");
        });
        
        return ResponseEntity.badRequest().body(build("Validation failed", errors.toString(), request));
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("[API] Unreadable request body | error={}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(build("Invalid request body", "Malformed JSON or unknown field value", request));
    }
    
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        return ResponseEntity.badRequest().body(build("Invalid request", ex.getMessage(), request));
    }
    
    @ExceptionHandler(ProviderFailureException.class)
    public ResponseEntity<ErrorResponse> handleProviderFailure(
            ProviderFailureException ex,
            WebRequest request
    ) {
        GenerationResponse response = ex.getResponse();
        log.warn("[API] AI provider request failed | provider={} | errorType={} | durationMs={}",
            response.getProvider(), response.getErrorType(), response.getResponseTimeMs());
        
        // Vendor messages stay in the logs
        String detail = response.getErrorType() != null ? response.getErrorType().getDescription() : null;
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(build("AI provider request failed", detail, request));
    }
    
    @ExceptionHandler({NoProviderAvailableException.class, NoSuitableModelException.class})
    public ResponseEntity<ErrorResponse> handleNoProvider(
            RuntimeException ex,
            WebRequest request
    ) {
        log.warn("[API] No provider can serve request | error={}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(build("No AI provider available", ex.getMessage(), request));
    }
    
    @ExceptionHandler(LlmConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(
            LlmConfigurationException ex,
            WebRequest request
    ) {
        log.error("[API] LLM configuration error | error={}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(build("AI service misconfigured", null, request));
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("[API] Unexpected error | type={}", ex.getClass().getSimpleName(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(build("An unexpected error occurred", null, request));
    }
    
    private ErrorResponse build(String error, String message, WebRequest request) {
        return ErrorResponse.builder()
            .error(error)
            .message(message)
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
    }
}
