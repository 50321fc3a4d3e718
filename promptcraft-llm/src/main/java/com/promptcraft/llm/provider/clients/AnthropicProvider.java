package com.promptcraft.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptcraft.llm.model.GenerationRequest;
import com.promptcraft.llm.model.GenerationResponse;
import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ModelConfig;
import com.promptcraft.llm.model.ProviderConfig;
import com.promptcraft.llm.provider.LlmProvider;
import com.promptcraft.llm.provider.ProviderErrorType;
import com.promptcraft.llm.provider.ProviderException;
import com.promptcraft.llm.provider.support.HealthProbe;
import com.promptcraft.llm.provider.support.ProviderExecutor;
import com.promptcraft.llm.provider.support.VendorResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Anthropic messages API provider.
 */
@Slf4j
public class AnthropicProvider implements LlmProvider {
    
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String DEFAULT_MODEL = "claude-3-haiku-20240307";
    private static final String MESSAGES_PATH = "/v1/messages";
    private static final String API_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 1000;
    private static final double DEFAULT_TEMPERATURE = 0.7;
    
    private final ProviderConfig config;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ProviderExecutor executor;
    
    public AnthropicProvider(ProviderConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                             ProviderExecutor executor) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getBaseUrl() != null ? config.getBaseUrl() : DEFAULT_BASE_URL)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, "application/json")
            .defaultHeader("anthropic-version", API_VERSION)
            .build();
    }
    
    @Override
    public GenerationResponse generate(GenerationRequest request) {
        String model = request.getModel() != null && !request.getModel().isBlank()
            ? request.getModel()
            : config.resolveModel(request).map(ModelConfig::getName).orElse(DEFAULT_MODEL);
        log.info("[ANTHROPIC] Starting content generation | provider={} | model={} | operation={}",
            config.getName(), model, request.getOperation());
        return executor.execute(config, request, model, (m, timeout) -> callApi(request, m, timeout));
    }
    
    @Override
    public HealthStatus checkHealth() {
        String model = config.defaultModel().map(ModelConfig::getName).orElse(DEFAULT_MODEL);
        return executor.probe(config, HealthProbe.REQUEST, model,
            (m, timeout) -> callApi(HealthProbe.REQUEST, m, timeout));
    }
    
    @Override
    public ProviderConfig getConfig() {
        return config.copy();
    }
    
    @Override
    public String getName() {
        return config.getName();
    }
    
    private VendorResult callApi(GenerationRequest request, String model, Duration timeout) throws ProviderException {
        long startTime = System.currentTimeMillis();
        
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", request.maxTokensOr(DEFAULT_MAX_TOKENS));
        body.put("temperature", request.temperatureOr(DEFAULT_TEMPERATURE));
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            body.put("system", request.getSystemPrompt());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", request.getUserPrompt())));
        
        try {
            log.debug("[ANTHROPIC] Sending request | model={} | path={}", model, MESSAGES_PATH);
            
            String response = webClient.post()
                .uri(MESSAGES_PATH)
                .header("x-api-key", config.getApiKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
            
            log.debug("[ANTHROPIC] Received response | model={} | durationMs={} | responseLength={}",
                model, System.currentTimeMillis() - startTime, response != null ? response.length() : 0);
            
            return parseResponse(response, model);
            
        } catch (WebClientResponseException e) {
            log.error("[ANTHROPIC] HTTP error | model={} | statusCode={} | statusText={} | durationMs={}",
                model, e.getStatusCode().value(), e.getStatusText(), System.currentTimeMillis() - startTime);
            throw mapException(e);
        } catch (WebClientRequestException e) {
            log.error("[ANTHROPIC] Connection failed | model={} | durationMs={} | error={}",
                model, System.currentTimeMillis() - startTime, e.getMessage());
            throw new ProviderException("Anthropic unreachable", config.getName(),
                ProviderErrorType.PROVIDER_UNAVAILABLE, 503, e);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new ProviderException("Request timeout", config.getName(), ProviderErrorType.TIMEOUT, 408, e);
            }
            log.error("[ANTHROPIC] Request failed | model={} | durationMs={} | error={}",
                model, System.currentTimeMillis() - startTime, e.getMessage(), e);
            throw new ProviderException("Anthropic request failed", config.getName(),
                ProviderErrorType.PROVIDER_UNAVAILABLE, 500, e);
        }
    }
    
    private VendorResult parseResponse(String response, String requestedModel) throws ProviderException {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ProviderException("Failed to parse Anthropic response", config.getName(),
                ProviderErrorType.INVALID_REQUEST, 502, e);
        }
        
        JsonNode content = root == null ? null : root.path("content");
        if (content == null || !content.isArray()) {
            throw new ProviderException("Anthropic response contained no content", config.getName(),
                ProviderErrorType.INVALID_REQUEST, 502);
        }
        
        // Concatenate text blocks; other block types (tool use) are ignored
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText("text"))) {
                text.append(block.path("text").asText(""));
            }
        }
        
        JsonNode usage = root.path("usage");
        return VendorResult.builder()
            .content(text.toString().trim())
            .model(root.path("model").asText(requestedModel))
            .inputTokens(usage.has("input_tokens") ? usage.get("input_tokens").asInt() : null)
            .outputTokens(usage.has("output_tokens") ? usage.get("output_tokens").asInt() : null)
            .build();
    }
    
    private ProviderException mapException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        // Anthropic signals overload with 529
        ProviderErrorType type = ProviderErrorType.fromStatus(status);
        
        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            if (error.has("error") && error.get("error").has("message")) {
                log.warn("[ANTHROPIC] Vendor error detail | statusCode={} | type={} | message={}",
                    status, error.get("error").path("type").asText(), error.get("error").get("message").asText());
            }
        } catch (Exception parseError) {
            log.debug("[ANTHROPIC] Error body was not JSON | statusCode={}", status);
        }
        
        String message;
        if (type == ProviderErrorType.AUTHENTICATION) {
            message = "Invalid API key";
        } else if (type == ProviderErrorType.RATE_LIMITED) {
            message = "Rate limit exceeded";
        } else if (type == ProviderErrorType.PROVIDER_UNAVAILABLE) {
            message = status == 529 ? "Anthropic service overloaded" : "Anthropic server error";
        } else if (type == ProviderErrorType.TIMEOUT) {
            message = "Request timeout";
        } else {
            message = String.format("Anthropic API error (%d)", status);
        }
        return new ProviderException(message, config.getName(), type, status, e);
    }
}
