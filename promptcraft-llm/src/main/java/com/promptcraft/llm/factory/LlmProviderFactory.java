package com.promptcraft.llm.factory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptcraft.llm.config.LlmProperties;
import com.promptcraft.llm.exception.LlmConfigurationException;
import com.promptcraft.llm.manager.LlmProviderManager;
import com.promptcraft.llm.manager.LoadBalancingStrategy;
import com.promptcraft.llm.manager.ManagerSettings;
import com.promptcraft.llm.mock.MockDataGenerator;
import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ProviderConfig;
import com.promptcraft.llm.model.ProviderType;
import com.promptcraft.llm.provider.LlmProvider;
import com.promptcraft.llm.provider.clients.AnthropicProvider;
import com.promptcraft.llm.provider.clients.MockProvider;
import com.promptcraft.llm.provider.clients.OpenAiProvider;
import com.promptcraft.llm.provider.support.ProviderExecutor;
import com.promptcraft.llm.provider.support.RetrySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Builds {@link LlmProviderManager} instances from {@link LlmProperties} and holds the
 * process-wide one.
 */
@Component
@Slf4j
public class LlmProviderFactory {
    
    private final LlmProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final MockDataGenerator mockDataGenerator;
    
    private volatile LlmProviderManager manager;
    
    public LlmProviderFactory(LlmProperties properties, WebClient.Builder webClientBuilder,
                              ObjectMapper objectMapper, MockDataGenerator mockDataGenerator) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
        this.mockDataGenerator = mockDataGenerator;
    }
    
    /**
     * Process-wide manager, created on first use. Concurrent first callers all receive
     * the same instance.
     */
    public LlmProviderManager getManager() {
        LlmProviderManager result = manager;
        if (result == null) {
            synchronized (this) {
                result = manager;
                if (result == null) {
                    result = createManager();
                    manager = result;
                }
            }
        }
        return result;
    }
    
    /**
     * Builds a new, independent manager. Only enabled providers are registered, and an
     * initial health sweep is started in the background.
     *
     * @throws LlmConfigurationException if the strategy is unknown or the default or
     *         fallback provider names no configured provider
     */
    public LlmProviderManager createManager() {
        List<ProviderConfig> configured = properties.getProviders() != null ? properties.getProviders() : List.of();
        LoadBalancingStrategy strategy = LoadBalancingStrategy.fromString(properties.getLoadBalancing().getStrategy());
        
        Set<String> configuredNames = configured.stream()
            .map(ProviderConfig::getName)
            .collect(Collectors.toSet());
        requireConfigured("default", properties.getDefaultProvider(), configuredNames);
        requireConfigured("fallback", properties.getFallbackProvider(), configuredNames);
        
        List<ProviderConfig> active = new ArrayList<>();
        for (ProviderConfig config : configured) {
            if (isActive(config)) {
                active.add(config);
            }
        }
        Set<String> activeNames = active.stream().map(ProviderConfig::getName).collect(Collectors.toSet());
        
        String defaultProvider = properties.getDefaultProvider();
        String fallbackProvider = properties.getFallbackProvider();
        if (properties.isSkipAiRequests()) {
            String mockName = active.isEmpty() ? null : active.get(0).getName();
            defaultProvider = mockName;
            fallbackProvider = mockName;
            log.info("[FACTORY] Mock mode enabled, routing to mock provider | provider={}", mockName);
        } else {
            defaultProvider = activeOrNull("default", defaultProvider, activeNames);
            fallbackProvider = activeOrNull("fallback", fallbackProvider, activeNames);
        }
        
        ManagerSettings settings = ManagerSettings.builder()
            .defaultProvider(defaultProvider)
            .fallbackProvider(fallbackProvider)
            .strategy(strategy)
            .costOptimization(properties.getCostOptimization().isEnabled())
            .maxCostPerRequestCents(properties.getCostOptimization().getMaxCostPerRequestCents())
            .defaultMaxTokens(properties.getDefaultMaxTokens())
            .build();
        
        ProviderExecutor executor = new ProviderExecutor(
            new RetrySettings(properties.getRetry().getBaseDelay(), properties.getRetry().getMaxDelay()));
        LlmProviderManager created = new LlmProviderManager(settings, config -> createProvider(config, executor));
        active.forEach(created::addProvider);
        created.validate();
        
        if (active.isEmpty()) {
            log.warn("[FACTORY] No LLM providers registered, generation requests will fail | configured={}",
                configured.size());
        }
        log.info("[FACTORY] LLM provider manager created | providers={} | strategy={} | default={} | fallback={} | costOptimization={}",
            activeNames, strategy, defaultProvider, fallbackProvider, settings.isCostOptimization());
        
        startHealthSweep(created);
        return created;
    }
    
    /**
     * Instantiates the provider implementation for the configured type.
     */
    public LlmProvider createProvider(ProviderConfig config, ProviderExecutor executor) {
        ProviderType type = config.getType() != null ? config.getType() : ProviderType.MOCK;
        switch (type) {
            case OPENAI:
                return new OpenAiProvider(config, webClientBuilder, objectMapper, executor);
            case ANTHROPIC:
                return new AnthropicProvider(config, webClientBuilder, objectMapper, executor);
            case MOCK:
                return new MockProvider(config, mockDataGenerator, executor);
            default:
                throw new LlmConfigurationException("Unsupported provider type: " + type);
        }
    }
    
    private boolean isActive(ProviderConfig config) {
        if (config.getName() == null || config.getName().isBlank()) {
            throw new LlmConfigurationException("Every configured provider needs a name");
        }
        if (!config.isEnabled()) {
            log.info("[FACTORY] Skipping disabled provider | provider={}", config.getName());
            return false;
        }
        if (properties.isSkipAiRequests() && config.getType() != ProviderType.MOCK) {
            log.info("[FACTORY] Skipping provider in mock mode | provider={} | type={}", config.getName(), config.getType());
            return false;
        }
        if (config.getType() != ProviderType.MOCK && !config.hasCredential()) {
            log.warn("[FACTORY] Skipping provider without API key | provider={} | type={}", config.getName(), config.getType());
            return false;
        }
        return true;
    }
    
    private void requireConfigured(String role, String name, Set<String> configuredNames) {
        if (name != null && !name.isBlank() && !configuredNames.contains(name)) {
            throw new LlmConfigurationException(
                "Configured " + role + " provider '" + name + "' does not match any provider in llm.providers "
                    + configuredNames);
        }
    }
    
    private String activeOrNull(String role, String name, Set<String> activeNames) {
        if (name == null || name.isBlank()) {
            return null;
        }
        if (!activeNames.contains(name)) {
            log.warn("[FACTORY] {} provider is not active, role cleared | provider={}", role, name);
            return null;
        }
        return name;
    }
    
    private void startHealthSweep(LlmProviderManager target) {
        CompletableFuture.supplyAsync(target::checkAllProviders)
            .whenComplete((results, error) -> {
                if (error != null) {
                    log.warn("[FACTORY] Initial health check failed | error={}", error.getMessage());
                    return;
                }
                long healthy = results.stream().filter(HealthStatus::isHealthy).count();
                log.info("[FACTORY] Initial health check finished | healthy={}/{}", healthy, results.size());
            });
    }
}
